package work.mdflow.expand.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.mdflow.expand.directive.ImportAction;

class InjectorTest {
    @Test
    void splicesReplacementsOfDifferentLengths() {
        var content = "[@./a.md] and [@./bb.md]";
        var first = ImportAction.FileImport.plain("./a.md", "@./a.md", 1);
        var second = ImportAction.FileImport.plain("./bb.md", "@./bb.md", 15);

        var result = Injector.inject(content, List.of(
            new ResolvedImport(first, "a much longer replacement"),
            new ResolvedImport(second, "")
        ));

        assertEquals("[a much longer replacement] and []", result);
    }

    @Test
    void orderOfResolvedEntriesDoesNotMatter() {
        var content = "@./x.md @./y.md";
        var x = ImportAction.FileImport.plain("./x.md", "@./x.md", 0);
        var y = ImportAction.FileImport.plain("./y.md", "@./y.md", 8);

        var forward = Injector.inject(content, List.of(new ResolvedImport(x, "X"), new ResolvedImport(y, "Y")));
        var reverse = Injector.inject(content, List.of(new ResolvedImport(y, "Y"), new ResolvedImport(x, "X")));

        assertEquals("X Y", forward);
        assertEquals(forward, reverse);
    }

    @Test
    void noReplacementsReturnsInput() {
        assertEquals("unchanged", Injector.inject("unchanged", List.of()));
    }

    @Test
    void rejectsSpanOutsideDocument() {
        var action = ImportAction.FileImport.plain("./a.md", "@./a.md", 10);
        assertThrows(IllegalArgumentException.class, () -> Injector.inject("short", List.of(new ResolvedImport(action, "x"))));
    }
}
