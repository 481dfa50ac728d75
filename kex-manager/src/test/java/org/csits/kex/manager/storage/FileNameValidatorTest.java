package org.csits.kex.manager.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.csits.kex.manager.exception.InvalidFileNameException;
import org.junit.jupiter.api.Test;

class FileNameValidatorTest {

    @Test
    void plainNames_areValid() {
        assertThat(FileNameValidator.isValid("Product_20250101120000_001_ab12cd34.json")).isTrue();
        assertThat(FileNameValidator.isValid("report.csv")).isTrue();
    }

    @Test
    void traversalAndSeparators_areInvalid() {
        assertThat(FileNameValidator.isValid(null)).isFalse();
        assertThat(FileNameValidator.isValid("  ")).isFalse();
        assertThat(FileNameValidator.isValid("..")).isFalse();
        assertThat(FileNameValidator.isValid("a..b.json")).isFalse();
        assertThat(FileNameValidator.isValid("../etc/passwd")).isFalse();
        assertThat(FileNameValidator.isValid("dir/file.json")).isFalse();
        assertThat(FileNameValidator.isValid("dir\\file.json")).isFalse();
        assertThat(FileNameValidator.isValid("C:file.json")).isFalse();
        assertThat(FileNameValidator.isValid(".hidden")).isFalse();
    }

    @Test
    void validate_throwsForInvalidName() {
        assertThatThrownBy(() -> FileNameValidator.validate("../x"))
            .isInstanceOf(InvalidFileNameException.class)
            .hasMessageContaining("../x");
        assertThat(FileNameValidator.validate("ok.json")).isEqualTo("ok.json");
    }
}
