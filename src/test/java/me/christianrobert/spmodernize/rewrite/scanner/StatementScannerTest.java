package me.christianrobert.spmodernize.rewrite.scanner;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatementScannerTest {

    private final StatementScanner scanner = new StatementScanner();

    @Test
    void locate_parenthesizedStatement() {
        String text = "BEGIN\n    RAISERROR (50002, 16, 1, @CustomError)\nEND";

        ScanResult result = scanner.locateLegacyStatement(text, 0);

        assertTrue(result.isFound());
        assertEquals(text.indexOf("RAISERROR"), result.getStart());
        assertEquals(text.indexOf(')') + 1, result.getEnd());
        ParsedLegacyStatement statement = result.getStatement();
        assertTrue(statement.isParenthesized());
        assertEquals("50002, 16, 1, @CustomError", statement.getParamListText());
        assertEquals("RAISERROR (50002, 16, 1, @CustomError)", statement.getRawText());
    }

    @Test
    void locate_nestedParenthesesStayInsideStatement() {
        String text = "RAISERROR('Order %s failed', 16, 1, CAST(@id AS NVARCHAR(20))); RETURN";

        ScanResult result = scanner.locateLegacyStatement(text, 0);

        assertTrue(result.isFound());
        assertEquals("RAISERROR('Order %s failed', 16, 1, CAST(@id AS NVARCHAR(20)))",
                text.substring(result.getStart(), result.getEnd()));
    }

    @Test
    void locate_unparenthesizedStatementEndsAtLine() {
        String text = "IF @x = 1\n    RAISERROR 50001 @ErrorMsg\nRETURN";

        ScanResult result = scanner.locateLegacyStatement(text, 0);

        assertTrue(result.isFound());
        ParsedLegacyStatement statement = result.getStatement();
        assertFalse(statement.isParenthesized());
        assertEquals("50001", statement.getCodeToken());
        assertEquals("@ErrorMsg", statement.getMessageText());
        assertEquals("RAISERROR 50001 @ErrorMsg", text.substring(result.getStart(), result.getEnd()));
    }

    @Test
    void locate_unparenthesizedExcludesTrailingSemicolon() {
        String text = "RAISERROR 50001 'Bad input';  \n";

        ScanResult result = scanner.locateLegacyStatement(text, 0);

        assertTrue(result.isFound());
        assertEquals("'Bad input'", result.getStatement().getMessageText());
        assertEquals(';', text.charAt(result.getEnd()));
    }

    @Test
    void locate_caseInsensitiveKeyword() {
        ScanResult result = scanner.locateLegacyStatement("raisError('x', 16, 1)", 0);

        assertTrue(result.isFound());
        assertEquals(0, result.getStart());
    }

    @Test
    void locate_ignoresKeywordInsideIdentifiers() {
        assertTrue(scanner.locateLegacyStatement("EXEC dbo.Log_RAISERROR_Calls @id", 0).isNotFound());
        assertTrue(scanner.locateLegacyStatement("SELECT @RAISERROR = 1", 0).isNotFound());
        assertTrue(scanner.locateLegacyStatement("SELECT RAISERRORS FROM t", 0).isNotFound());
    }

    @Test
    void locate_unbalancedParenthesesIsAmbiguous() {
        String text = "RAISERROR('broken', 16, 1";

        ScanResult result = scanner.locateLegacyStatement(text, 0);

        assertTrue(result.isAmbiguous());
        assertEquals(0, result.getStart());
        assertEquals(StatementScanner.KEYWORD.length(), result.getResumeOffset());
        assertEquals("unbalanced parentheses", result.getReason());
    }

    @Test
    void locate_emptyParameterListIsAmbiguous() {
        assertTrue(scanner.locateLegacyStatement("RAISERROR()", 0).isAmbiguous());
        assertTrue(scanner.locateLegacyStatement("RAISERROR( , 16, 1)", 0).isAmbiguous());
    }

    @Test
    void locate_keywordAloneIsAmbiguous() {
        ScanResult result = scanner.locateLegacyStatement("RAISERROR @msg", 0);

        assertTrue(result.isAmbiguous());
        assertEquals("unsupported RAISERROR form", result.getReason());
    }

    @Test
    void locate_unparenthesizedNonNumericCodeIsAmbiguous() {
        ScanResult result = scanner.locateLegacyStatement("RAISERROR 5000x @msg", 0);

        assertTrue(result.isAmbiguous());
        assertTrue(result.getReason().contains("5000x"));
    }

    @Test
    void locate_unparenthesizedWithoutMessageIsAmbiguous() {
        ScanResult result = scanner.locateLegacyStatement("RAISERROR 50001\nRETURN", 0);

        assertTrue(result.isAmbiguous());
        assertEquals("no message after error number", result.getReason());
    }

    @Test
    void locate_numberOnNextLineIsNotUnparenthesizedForm() {
        assertTrue(scanner.locateLegacyStatement("RAISERROR\n50001 @msg", 0).isAmbiguous());
    }

    @Test
    void locate_startsFromOffset() {
        String text = "RAISERROR('a', 16, 1)\nRAISERROR('b', 16, 1)";
        int second = text.lastIndexOf("RAISERROR");

        ScanResult result = scanner.locateLegacyStatement(text, 1);

        assertTrue(result.isFound());
        assertEquals(second, result.getStart());
    }

    @Test
    void locate_notFound() {
        assertTrue(scanner.locateLegacyStatement("SELECT 1", 0).isNotFound());
        assertTrue(scanner.locateLegacyStatement("", 0).isNotFound());
        assertTrue(scanner.locateLegacyStatement(null, 0).isNotFound());
        assertTrue(scanner.locateLegacyStatement("RAISERROR('a', 16, 1)", 50).isNotFound());
    }
}
