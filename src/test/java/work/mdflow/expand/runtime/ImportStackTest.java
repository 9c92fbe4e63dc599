package work.mdflow.expand.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ImportStackTest {
    @Test
    void pushReturnsExtendedCopy() {
        var a = Path.of("/docs/a.md");
        var b = Path.of("/docs/b.md");
        var base = ImportStack.of(a);
        var extended = base.push(b);

        assertTrue(extended.contains(a));
        assertTrue(extended.contains(b));
        assertFalse(base.contains(b));
        assertEquals(1, base.depth());
        assertEquals(2, extended.depth());
    }

    @Test
    void siblingBranchesDoNotSeeEachOther() {
        var root = ImportStack.of(Path.of("/r.md"));
        var left = root.push(Path.of("/left.md"));
        var right = root.push(Path.of("/right.md"));

        assertFalse(left.contains(Path.of("/right.md")));
        assertFalse(right.contains(Path.of("/left.md")));
    }

    @Test
    void rendersCycleChain() {
        var stack = ImportStack.of(Path.of("/a.md"), Path.of("/b.md"));
        assertEquals(
            Path.of("/a.md") + " -> " + Path.of("/b.md") + " -> " + Path.of("/a.md"),
            stack.chainTo(Path.of("/a.md"))
        );
    }

    @Test
    void emptyStackContainsNothing() {
        assertEquals(0, ImportStack.empty().depth());
        assertTrue(ImportStack.empty().paths().isEmpty());
    }
}
