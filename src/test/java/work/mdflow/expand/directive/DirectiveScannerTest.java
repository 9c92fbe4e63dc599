package work.mdflow.expand.directive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DirectiveScannerTest {
    @Test
    void documentWithoutCodeIsOneSafeRange() {
        var content = "Plain prose with @./file.md in it.";
        assertEquals(List.of(new SafeRange(0, content.length())), DirectiveScanner.safeRanges(content));
    }

    @Test
    void emptyDocumentHasNoRanges() {
        var scan = DirectiveScanner.scan("");
        assertTrue(scan.safeRanges().isEmpty());
        assertTrue(scan.unsafeStarts().isEmpty());
    }

    @Test
    void inlineCodeSplitsTheSafeRange() {
        var ranges = DirectiveScanner.safeRanges("a `b` c");
        assertEquals(List.of(new SafeRange(0, 2), new SafeRange(5, 7)), ranges);
    }

    @Test
    void inlineCodeEndsAtNewline() {
        var ranges = DirectiveScanner.safeRanges("a `b\nc");
        assertEquals(List.of(new SafeRange(0, 2), new SafeRange(4, 6)), ranges);
    }

    @Test
    void tildeFenceIsUnsafeUntilItCloses() {
        var content = "~~~\n@./x\n~~~\nafter";
        var scan = DirectiveScanner.scan(content);
        assertEquals(List.of(new SafeRange(13, 18)), scan.safeRanges());
        assertEquals(Set.of(0), scan.unsafeStarts());
        assertFalse(scan.isSafe(4));
        assertTrue(scan.isSafe(13));
    }

    @Test
    void unterminatedFenceConsumesTheRest() {
        var content = "text\n```\ncode @./x";
        var scan = DirectiveScanner.scan(content);
        assertEquals(List.of(new SafeRange(0, 5)), scan.safeRanges());
        assertEquals(Set.of(5), scan.unsafeStarts());
    }

    @Test
    void shorterRunDoesNotCloseFence() {
        var content = "````\n```\ninner\n```\n````\nafter";
        var ranges = DirectiveScanner.safeRanges(content);
        assertEquals(1, ranges.size());
        assertEquals("after", content.substring(ranges.get(0).start(), ranges.get(0).end()));
    }

    @Test
    void closingFenceMustStartALine() {
        var content = "```\ncode ``` still code\n```\nout";
        var ranges = DirectiveScanner.safeRanges(content);
        assertEquals(1, ranges.size());
        assertEquals("out", content.substring(ranges.get(0).start()));
    }

    @Test
    void recordsUnsafeStartsBetweenRanges() {
        var content = "intro\n```sh\necho\n```\nmiddle `x` end";
        var scan = DirectiveScanner.scan(content);
        assertTrue(scan.isUnsafeStart(content.indexOf("```")));
        assertTrue(scan.isUnsafeStart(content.indexOf('`', content.indexOf("middle"))));
        assertFalse(scan.isUnsafeStart(0));
    }
}
