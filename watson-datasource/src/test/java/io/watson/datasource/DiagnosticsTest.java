package io.watson.datasource;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosticsTest {

    @Test
    void keepsInsertionOrderAndSplitsBySeverity() {
        Diagnostics diagnostics = new Diagnostics()
                .addWarning("w1", "first")
                .addError("e1", "second")
                .addWarning("w2", null);

        assertThat(diagnostics.hasError()).isTrue();
        assertThat(diagnostics.asList()).extracting(Diagnostic::summary).containsExactly("w1", "e1", "w2");
        assertThat(diagnostics.errors()).extracting(Diagnostic::summary).containsExactly("e1");
        assertThat(diagnostics.warnings()).extracting(Diagnostic::detail).containsExactly("first", "");
    }

    @Test
    void warningsAloneAreNotErrors() {
        assertThat(new Diagnostics().addWarning("w", "d").hasError()).isFalse();
        assertThat(new Diagnostics().hasError()).isFalse();
    }

    @Test
    void unknownSettingHasNoValue() {
        assertThat(Setting.unknownValue().value()).isNull();
        assertThat(Setting.unknownValue().unknown()).isTrue();
        assertThat(Setting.of("x").unknown()).isFalse();
        assertThat(Setting.unset().unknown()).isFalse();
        assertThat(Setting.of(null)).isEqualTo(Setting.unset());
        assertThatThrownBy(() -> new Setting("x", true)).isInstanceOf(IllegalArgumentException.class);
    }
}
