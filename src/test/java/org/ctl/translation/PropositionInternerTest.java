package org.ctl.translation;

import org.ctl.formula.FormulaFixtures;
import org.ctl.formula.FormulaNode;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * Deduplicazione e numerazione delle proposizioni atomiche.
 */
public class PropositionInternerTest {

    private static FormulaNode atom(String fragment) {
        return FormulaFixtures.formula(fragment).getChild(0);
    }

    @Test
    public void testSymbolsAllocatedInOrder() {
        PropositionInterner interner = new PropositionInterner();

        assertEquals("p0", interner.intern(atom("<is-fireable><transition>t1</transition></is-fireable>")));
        assertEquals("p1", interner.intern(atom("<is-fireable><transition>t2</transition></is-fireable>")));
        assertEquals("p2", interner.intern(atom("<is-fireable><transition>t3</transition></is-fireable>")));
        assertEquals(3, interner.size());
    }

    /**
     * Due sottoalberi con la stessa forma ricevono lo stesso simbolo anche se
     * il documento li scrive in modo diverso.
     */
    @Test
    public void testEquivalentSubtreesShareSymbol() {
        PropositionInterner interner = new PropositionInterner();

        String compact = interner.intern(atom(
                "<integer-le><tokens-count><place>P1</place></tokens-count>"
                        + "<integer-constant>3</integer-constant></integer-le>"));
        String indented = interner.intern(atom(
                "<integer-le>\n  <tokens-count>\n    <place> P1 </place>\n  </tokens-count>\n"
                        + "  <!-- bound -->\n  <integer-constant>3</integer-constant>\n</integer-le>"));

        assertEquals("p0", compact);
        assertEquals(compact, indented);
        assertEquals(1, interner.size());
    }

    @Test
    public void testCanonicalKeyIgnoresNamespacePrefix() {
        FormulaNode prefixed = FormulaFixtures.element(
                "<m:is-fireable xmlns:m=\"http://mcc.lip6.fr/\"><m:transition>t1</m:transition></m:is-fireable>");
        FormulaNode plain = atom("<is-fireable><transition>t1</transition></is-fireable>");

        assertEquals(PropositionInterner.canonicalKey(plain), PropositionInterner.canonicalKey(prefixed));
        assertEquals("<is-fireable><transition>t1</transition></is-fireable>",
                PropositionInterner.canonicalKey(plain));
    }

    /**
     * Lo stesso nome locale in un namespace estraneo è un'altra proposizione.
     */
    @Test
    public void testForeignNamespaceGetsDistinctSymbol() {
        PropositionInterner interner = new PropositionInterner();
        FormulaNode mcc = atom("<is-fireable><transition>t1</transition></is-fireable>");
        FormulaNode foreign = atom(
                "<is-fireable><x:transition xmlns:x=\"urn:other\">t1</x:transition></is-fireable>");

        assertEquals("p0", interner.intern(mcc));
        assertEquals("p1", interner.intern(foreign));
        assertEquals("p0", interner.intern(mcc));
        assertEquals("<is-fireable><{urn:other}transition>t1</{urn:other}transition></is-fireable>",
                PropositionInterner.canonicalKey(foreign));
    }

    @Test
    public void testCanonicalKeyEscapesText() {
        assertEquals("<place>a&lt;b&amp;c</place>",
                PropositionInterner.canonicalKey(atom("<place>a&lt;b&amp;c</place>")));
        assertEquals("<true/>", PropositionInterner.canonicalKey(atom("<true/>")));
    }

    /**
     * Una sessione nuova riparte da p0: due interner non condividono stato.
     */
    @Test
    public void testSessionsAreIndependent() {
        FormulaNode t1 = atom("<is-fireable><transition>t1</transition></is-fireable>");
        FormulaNode t2 = atom("<is-fireable><transition>t2</transition></is-fireable>");

        PropositionInterner first = new PropositionInterner();
        first.intern(t1);
        first.intern(t2);

        PropositionInterner second = new PropositionInterner();
        assertEquals("p0", second.intern(t2));
        assertEquals(2, first.size());
        assertEquals(1, second.size());
    }

    @Test
    public void testRollbackReleasesSymbols() {
        PropositionInterner interner = new PropositionInterner();
        interner.intern(atom("<is-fireable><transition>t1</transition></is-fireable>"));

        int mark = interner.mark();
        interner.intern(atom("<is-fireable><transition>t2</transition></is-fireable>"));
        interner.intern(atom("<is-fireable><transition>t3</transition></is-fireable>"));
        assertEquals(3, interner.size());

        interner.rollback(mark);
        assertEquals(1, interner.size());
        assertEquals("p1", interner.intern(atom("<is-fireable><transition>t4</transition></is-fireable>")));
        assertEquals("p0", interner.intern(atom("<is-fireable><transition>t1</transition></is-fireable>")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRollbackBeyondSizeRejected() {
        new PropositionInterner().rollback(1);
    }

    @Test
    public void testTableLines() {
        PropositionInterner interner = new PropositionInterner();
        interner.intern(atom("<is-fireable><transition>t1</transition></is-fireable>"));
        interner.intern(atom("<place>P1</place>"));

        List<String> lines = interner.toTableLines();
        assertEquals(2, lines.size());
        assertEquals("p0\t<is-fireable><transition>t1</transition></is-fireable>", lines.get(0));
        assertEquals("p1\t<place>P1</place>", lines.get(1));
        assertEquals("p1", interner.entries().get("<place>P1</place>"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullNodeRejected() {
        new PropositionInterner().intern(null);
    }
}
