package fr.uga.amdn.formula;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormulaArenaTest {

    private final FormulaArena arena = new FormulaArena();

    @Test
    void identicalFormulasShareOneNode() {
        int x = this.arena.variable("x");
        int y = this.arena.variable("y");
        int first = this.arena.or(this.arena.and(x, this.arena.not(y)), y);
        int size = this.arena.size();
        int second = this.arena.or(this.arena.and(this.arena.variable("x"), this.arena.not(y)), y);
        assertEquals(first, second);
        assertEquals(size, this.arena.size());
        assertNotEquals(first, this.arena.or(y, this.arena.and(x, this.arena.not(y))));
    }

    @Test
    void recognizesLiteralsAndClauses() {
        int x = this.arena.variable("x");
        int y = this.arena.variable("y");
        assertTrue(this.arena.isLiteral(x));
        assertTrue(this.arena.isLiteral(this.arena.not(x)));
        assertFalse(this.arena.isLiteral(this.arena.not(this.arena.not(x))));
        assertTrue(this.arena.isClause(this.arena.implies(x, y)));
        assertTrue(this.arena.isClause(this.arena.or(x)));
        assertFalse(this.arena.isClause(this.arena.and(x, y)));
        assertFalse(this.arena.isClause(this.arena.or(x, this.arena.and(x, y))));
    }

    @Test
    void rendersFormulas() {
        int x = this.arena.variable("x");
        int y = this.arena.variable("y");
        assertEquals("((x & ~y) | y)", this.arena.toString(this.arena.or(this.arena.and(x, this.arena.not(y)), y)));
    }

    @Test
    void rejectsUnknownNodesAndEmptyConnectives() {
        assertThrows(IllegalArgumentException.class, () -> this.arena.not(42));
        assertThrows(IllegalArgumentException.class, () -> this.arena.and());
    }
}
