package io.sunplane.vault;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

final class DotenvScannerTest {

    @Test
    void classifiesEncryptedAndPlaintextValues() {
        String text = String.join("\n",
                "# comment",
                "",
                "API_KEY=encrypted:abc",
                "export DB_PASS='es2:xyz'",
                "DEBUG=true # inline",
                "EMPTY=",
                "ONLY_COMMENT= # nothing",
                "not an assignment",
                "=orphan",
                "QUOTED=\"encrypted:has # hash\"");

        DotenvScanner.Scan scan = DotenvScanner.scan(text.getBytes(StandardCharsets.UTF_8));

        Assertions.assertEquals(List.of("API_KEY", "DB_PASS", "QUOTED"), scan.encryptedKeys());
        Assertions.assertEquals(List.of("DEBUG"), scan.plaintextKeys());
    }

    @Test
    void parsesAssignmentsLikeAShellWould() {
        Assertions.assertEquals(new DotenvScanner.Assignment("A", "b c"), DotenvScanner.parseAssignment("A = \"b c\"  # tail"));
        Assertions.assertEquals(new DotenvScanner.Assignment("A", "x#y"), DotenvScanner.parseAssignment("A=x#y"));
        Assertions.assertEquals(new DotenvScanner.Assignment("K", "v"), DotenvScanner.parseAssignment("export\tK=v"));
        Assertions.assertNull(DotenvScanner.parseAssignment("   # A=1"));
        Assertions.assertNull(DotenvScanner.parseAssignment("   "));
    }

    @Test
    void emptyInputHasNoKeys() {
        DotenvScanner.Scan scan = DotenvScanner.scan(null);

        Assertions.assertTrue(scan.encryptedKeys().isEmpty());
        Assertions.assertTrue(scan.plaintextKeys().isEmpty());
    }
}
