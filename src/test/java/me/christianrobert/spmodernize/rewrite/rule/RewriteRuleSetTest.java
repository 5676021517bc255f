package me.christianrobert.spmodernize.rewrite.rule;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RewriteRuleSetTest {

    private final RewriteRuleSet ruleSet = new RewriteRuleSet();

    @Test
    void apply_replacesDeprecatedTypes() {
        List<String> applied = new ArrayList<>();

        String result = ruleSet.apply("DECLARE @notes TEXT , @blob IMAGE\n", false, applied);

        assertEquals("DECLARE @notes NVARCHAR(MAX) , @blob VARBINARY(MAX)\n", result);
        assertTrue(applied.contains(RewriteRuleSet.TEXT_TYPE));
        assertTrue(applied.contains(RewriteRuleSet.IMAGE_TYPE));
    }

    @Test
    void apply_typeRuleNeedsWhitespaceOnBothSides() {
        List<String> applied = new ArrayList<>();
        String text = "SELECT ContextText, TEXT) FROM t";

        assertEquals(text, ruleSet.apply(text, false, applied));
        assertTrue(applied.isEmpty());
    }

    @Test
    void apply_replacesGetdate() {
        List<String> applied = new ArrayList<>();

        String result = ruleSet.apply("SET @now = getdate( );", false, applied);

        assertEquals("SET @now = SYSDATETIME();", result);
        assertEquals(List.of(RewriteRuleSet.GETDATE_FUNCTION), applied);
    }

    @Test
    void apply_replacesOuterJoinOperatorsTextually() {
        List<String> applied = new ArrayList<>();

        String result = ruleSet.apply("WHERE a.id *= b.id AND c.id =* d.id", false, applied);

        assertEquals("WHERE a.id LEFT JOIN b.id AND c.id RIGHT JOIN d.id", result);
        assertTrue(applied.contains(RewriteRuleSet.LEFT_OUTER_JOIN_MARKER));
        assertTrue(applied.contains(RewriteRuleSet.RIGHT_OUTER_JOIN_MARKER));
    }

    @Test
    void apply_turnsSettingsOn() {
        List<String> applied = new ArrayList<>();

        String result = ruleSet.apply("SET ANSI_NULLS OFF\nSET  quoted_identifier  off\n", false, applied);

        assertEquals("SET ANSI_NULLS ON\nSET QUOTED_IDENTIFIER ON\n", result);
    }

    @Test
    void apply_createBecomesAlterOnlyWhenTextChanged() {
        List<String> applied = new ArrayList<>();
        String unchanged = "CREATE PROCEDURE dbo.P AS SELECT 1";

        assertEquals(unchanged, ruleSet.apply(unchanged, false, applied));
        assertTrue(applied.isEmpty());

        String result = ruleSet.apply("CREATE PROCEDURE dbo.P AS SELECT GETDATE()", false, applied);
        assertEquals("ALTER PROCEDURE dbo.P AS SELECT SYSDATETIME()", result);
        assertTrue(applied.contains(DefinitionKeywordRule.NAME));
    }

    @Test
    void apply_createBecomesAlterWhenStatementsWereConverted() {
        List<String> applied = new ArrayList<>();

        String result = ruleSet.apply("create proc dbo.P AS ;THROW 50000, @m, 1", true, applied);

        assertEquals("ALTER proc dbo.P AS ;THROW 50000, @m, 1", result);
        assertEquals(List.of(DefinitionKeywordRule.NAME), applied);
    }

    @Test
    void apply_isIdempotent() {
        String text = "CREATE PROCEDURE dbo.P AS\nDECLARE @t TEXT \nSELECT GETDATE() FROM a, b WHERE a.x *= b.x\n";

        String once = ruleSet.apply(text, false, new ArrayList<>());
        String twice = ruleSet.apply(once, false, new ArrayList<>());

        assertEquals(once, twice);
    }

    @Test
    void definitionRule_onlyFirstPairIsInspected() {
        DefinitionKeywordRule rule = new DefinitionKeywordRule();

        assertEquals("ALTER PROCEDURE p AS EXEC('CREATE VIEW v AS SELECT 1')",
                rule.apply("CREATE PROCEDURE p AS EXEC('CREATE VIEW v AS SELECT 1')"));
        assertEquals("ALTER PROCEDURE p AS EXEC('CREATE VIEW v AS SELECT 1')",
                rule.apply("ALTER PROCEDURE p AS EXEC('CREATE VIEW v AS SELECT 1')"));
    }

    @Test
    void promoteToCreateOrAlter_keepsAlterTextAsIs() {
        assertEquals("CREATE OR ALTER PROCEDURE dbo.P AS SELECT 1",
                DefinitionKeywordRule.promoteToCreateOrAlter("CREATE PROCEDURE dbo.P AS SELECT 1"));
        assertEquals("ALTER PROCEDURE dbo.P AS SELECT 1",
                DefinitionKeywordRule.promoteToCreateOrAlter("ALTER PROCEDURE dbo.P AS SELECT 1"));
    }

    @Test
    void patternRule_replacementIsLiteral() {
        PatternRewriteRule rule = new PatternRewriteRule("DOLLAR", "price", "$1.00");

        assertEquals("SELECT $1.00", rule.apply("SELECT PRICE"));
        assertEquals("SELECT cost", rule.apply("SELECT cost"));
    }
}
