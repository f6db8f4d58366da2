package io.watson.datasource;

import io.watson.client.Output;
import io.watson.client.OutputValue;
import io.watson.client.Outputs;
import io.watson.core.WatsonException;
import io.watson.json.spi.JsonNodeType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OutputsDataSourceTest {

    @Test
    void keepsStringOutputs() {
        StubWatsonClient client = new StubWatsonClient().withOutputs("backend/load-balancers", new Outputs(Map.of(
                "hostname", new Output(OutputValue.text("https://hello.example"), "", "", false))));

        OutputsReadResult result = new OutputsDataSource(client).read("backend/load-balancers");

        assertThat(result.id()).isEqualTo("backend/load-balancers");
        assertThat(result.outputs()).containsOnlyKeys("hostname");
        assertThat(result.outputs().get("hostname"))
                .isEqualTo(new OutputAttributes("https://hello.example", false, "", ""));
        assertThat(result.diagnostics().isEmpty()).isTrue();
    }

    @Test
    void nonStringOutputsAreIgnoredWithWarning() {
        Map<String, Output> entries = new LinkedHashMap<>();
        entries.put("hostname", new Output(OutputValue.text("h"), "", "", false));
        entries.put("count", new Output(OutputValue.other(JsonNodeType.NUMBER, "3"), "", "", false));
        StubWatsonClient client = new StubWatsonClient().withOutputs("a/b", new Outputs(entries));

        OutputsReadResult result = new OutputsDataSource(client).read("a/b");

        assertThat(result.outputs()).containsOnlyKeys("hostname");
        assertThat(result.diagnostics().hasError()).isFalse();
        assertThat(result.diagnostics().warnings()).containsExactly(
                Diagnostic.warning("ignored output", "output \"count\" has type number and is ignored for now"));
    }

    @Test
    void deprecationAndWarningAreReportedIndependently() {
        Map<String, Output> entries = new LinkedHashMap<>();
        entries.put("old", new Output(OutputValue.text("v1"), "use new", "", false));
        entries.put("shaky", new Output(OutputValue.text("v2"), "", "might move", true));
        StubWatsonClient client = new StubWatsonClient().withOutputs("a/b", new Outputs(entries));

        OutputsReadResult result = new OutputsDataSource(client).read("a/b");

        assertThat(result.outputs()).containsOnlyKeys("old", "shaky");
        assertThat(result.outputs().get("shaky").sensitive()).isTrue();
        assertThat(result.diagnostics().asList()).containsExactly(
                Diagnostic.warning("Output old is deprecated", "use new"),
                Diagnostic.warning("The output shaky has a warning", "might move"));
    }

    @Test
    void missingStackIsError() {
        OutputsReadResult result = new OutputsDataSource(new StubWatsonClient()).read("hello/world");

        assertThat(result.outputs()).isEmpty();
        assertThat(result.diagnostics().errors()).containsExactly(
                Diagnostic.error("Unknown stack", "No stack named \"hello/world\" could be found"));
    }

    @Test
    void clientFailureIsError() {
        StubWatsonClient client = new StubWatsonClient().failingWith(new WatsonException.UnexpectedStatus(500));

        OutputsReadResult result = new OutputsDataSource(client).read("a/b");

        assertThat(result.diagnostics().errors()).containsExactly(
                Diagnostic.error("Failed to read outputs of \"a/b\"", "unexpected status code: 500"));
    }

    @Test
    void invalidStackNameIsError() {
        StubWatsonClient client = new StubWatsonClient().failingWith(new WatsonException.InvalidStackName("hello"));

        OutputsReadResult result = new OutputsDataSource(client).read("hello");

        assertThat(result.diagnostics().hasError()).isTrue();
        assertThat(result.diagnostics().errors().get(0).detail()).isEqualTo("\"hello\" is not a valid stack name");
    }
}
