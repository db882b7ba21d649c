package fr.imt.distroforge.distroforge.business.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileNameSanitizerTest {

    @Test
    void keepsSafeNames() {
        assertEquals("distroforge-arch.iso", FileNameSanitizer.sanitize("distroforge-arch.iso"));
    }

    @Test
    void neutralizesTraversalAndSeparators() {
        String sanitized = FileNameSanitizer.sanitize("../../etc/passwd");

        assertFalse(sanitized.contains("/"));
        assertFalse(sanitized.contains(".."));
    }

    @Test
    void truncatesLongNames() {
        assertEquals(255, FileNameSanitizer.sanitize("a".repeat(300)).length());
    }
}
