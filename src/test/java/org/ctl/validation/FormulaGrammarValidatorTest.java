package org.ctl.validation;

import org.ctl.translation.DialectConfig;
import org.junit.Test;

import java.util.Set;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.junit.Assert.*;

/**
 * Accettazione e rifiuto delle formule rispetto alla grammatica dei due dialetti.
 */
public class FormulaGrammarValidatorTest {

    private final FormulaGrammarValidator validator = new FormulaGrammarValidator();

    @Test
    public void testSymbolicFormulaAccepted() {
        ValidationReport report = validator.validate("AG ((p0 & p1))", DialectConfig.SYMBOLIC);

        assertTrue(report.errors().toString(), report.isValid());
        assertEquals(4, report.info().size());
        assertEquals(1, report.info().temporalOperators());
        assertEquals(Set.of("p0", "p1"), report.info().atoms());
        assertEquals(0, report.info().comparisons());
    }

    @Test
    public void testNextRewriteAccepted() {
        ValidationReport report = validator.validate("A(false W (p0))", DialectConfig.SYMBOLIC);

        assertTrue(report.errors().toString(), report.isValid());
        assertEquals(3, report.info().size());
        assertEquals(1, report.info().temporalOperators());
    }

    /**
     * Il terminatore finale appartiene al file e viene ignorato.
     */
    @Test
    public void testKeywordFormulaWithTerminatorAccepted() {
        ValidationReport report = validator.validate("EX (NOT((p0 AND TRUE))):", DialectConfig.KEYWORD);

        assertTrue(report.errors().toString(), report.isValid());
        assertEquals("EX (NOT((p0 AND TRUE)))", report.formula());
    }

    @Test
    public void testStructuralAtomsMeasured() {
        ValidationReport report = validator.validate("AG (((P1 + P2 <= 3) & t1))", DialectConfig.SYMBOLIC);

        assertTrue(report.errors().toString(), report.isValid());
        assertEquals(1, report.info().comparisons());
        assertEquals(Set.of("P1", "P2", "t1"), report.info().atoms());
        assertEquals(4, report.info().size());
    }

    /**
     * Posti che si chiamano come una parola chiave restano nomi nei confronti e come atomi.
     */
    @Test
    public void testKeywordNamedPlacesAccepted() {
        ValidationReport symbolic = validator.validate("AG ((A <= 3))", DialectConfig.SYMBOLIC);
        assertTrue(symbolic.errors().toString(), symbolic.isValid());
        assertEquals(Set.of("A"), symbolic.info().atoms());
        assertEquals(1, symbolic.info().comparisons());

        ValidationReport mixed = validator.validate("EF (((E + U <= W) & AG))", DialectConfig.SYMBOLIC);
        assertTrue(mixed.errors().toString(), mixed.isValid());
        assertEquals(Set.of("E", "U", "W", "AG"), mixed.info().atoms());

        ValidationReport keyword = validator.validate("A(TRUE U (OR AND NOT)):", DialectConfig.KEYWORD);
        assertTrue(keyword.errors().toString(), keyword.isValid());
        assertEquals(Set.of("OR", "NOT"), keyword.info().atoms());
    }

    @Test
    public void testOperatorSymbolIsNotAnIdentifier() {
        ValidationReport report = validator.validate("AG ((& <= 3))", DialectConfig.SYMBOLIC);

        assertFalse(report.isValid());
        assertThat(report.errors(), hasItem(containsString("identificatore non valido")));
    }

    @Test
    public void testNativeNextRejectedInSymbolicDialect() {
        ValidationReport report = validator.validate("AX (p0)", DialectConfig.SYMBOLIC);

        assertFalse(report.isValid());
        assertNotNull(report.info());
        assertThat(report.errors(), hasItem(containsString("non ammette l'operatore next")));
    }

    @Test
    public void testForeignSpellingsRejected() {
        assertFalse(validator.validate("AG ((p0 AND p1))", DialectConfig.SYMBOLIC).isValid());
        assertFalse(validator.validate("EF (!(p0))", DialectConfig.KEYWORD).isValid());
        assertFalse(validator.validate("A(true U p2)", DialectConfig.KEYWORD).isValid());
        assertTrue(validator.validate("A(TRUE U p2)", DialectConfig.KEYWORD).isValid());
    }

    @Test
    public void testSyntaxErrorsReported() {
        ValidationReport unbalanced = validator.validate("AG ((p0 & p1)", DialectConfig.SYMBOLIC);
        assertFalse(unbalanced.isValid());
        assertNull(unbalanced.info());

        assertFalse(validator.validate("AG (p0) p1", DialectConfig.SYMBOLIC).isValid());
        assertFalse(validator.validate("AG (p0 # p1)", DialectConfig.SYMBOLIC).isValid());
        assertFalse(validator.validate("", DialectConfig.SYMBOLIC).isValid());
    }

    /**
     * Nel dialetto simbolico il terminatore è vuoto: i due punti restano nella formula.
     */
    @Test
    public void testColonRejectedInSymbolicDialect() {
        assertFalse(validator.validate("AG (p0):", DialectConfig.SYMBOLIC).isValid());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullFormulaRejected() {
        validator.validate(null, DialectConfig.SYMBOLIC);
    }
}
