package com.mimecast.wren.chunking;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkingEngineTest {

    private static final String DOCUMENT = "# Quarterly report\n\n" +
            "Revenue grew by twelve percent in the third quarter. Costs stayed flat! Was that expected?\n\n" +
            "The board approved the new budget.  Hiring resumes in January.\n" +
            "Two offices will open next year, one in Lisbon and one in Porto.\n\n" +
            "## Risks\n" +
            "Currency exposure remains the main risk (see appendix \"B\").\n\n\n" +
            "  Trailing   spaces   and\ttabs are kept.  \n";

    private final ChunkingEngine engine = new ChunkingEngine();

    @ParameterizedTest
    @EnumSource(ChunkingStrategy.class)
    void testReconstruction(ChunkingStrategy strategy) {
        for (int max = 3; max <= 20; max += 4) {
            for (int overlap = 0; overlap < max; overlap += 2) {
                List<Chunk> chunks = engine.chunk(DOCUMENT, strategy, max, overlap);

                assertEquals(DOCUMENT, ChunkingEngine.reconstruct(chunks), strategy + " max " + max + " overlap " + overlap);
                for (int i = 0; i < chunks.size(); i++) {
                    Chunk chunk = chunks.get(i);
                    assertEquals(i, chunk.getIndex());
                    assertEquals(DOCUMENT.substring(chunk.getStart(), chunk.getEnd()), chunk.getText());
                }
            }
        }
    }

    @ParameterizedTest
    @EnumSource(ChunkingStrategy.class)
    void testIdempotent(ChunkingStrategy strategy) {
        assertEquals(engine.chunk(DOCUMENT, strategy, 9, 2), engine.chunk(DOCUMENT, strategy, 9, 2));
    }

    @Test
    void testTokenChunksAndOverlap() {
        List<Chunk> chunks = engine.chunk("one two three four five six seven eight nine ten", ChunkingStrategy.TOKEN, 4, 1);

        assertEquals(3, chunks.size());
        assertEquals("one two three four ", chunks.get(0).getText());
        assertEquals("four five six seven ", chunks.get(1).getText());
        assertEquals("seven eight nine ten", chunks.get(2).getText());
        assertEquals(0, chunks.get(0).getOverlapTokens());

        for (int i = 1; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            assertEquals(1, chunk.getOverlapTokens());
            assertTrue(chunk.getTokenCount() <= 4);
            assertTrue(chunks.get(i - 1).getText().endsWith(chunk.getText().substring(0, chunk.getOverlapChars())));
        }
    }

    @Test
    void testTokenNeverExceedsMax() {
        for (Chunk chunk : engine.chunk(DOCUMENT, ChunkingStrategy.TOKEN, 7, 3)) {
            assertTrue(chunk.getTokenCount() <= 7, chunk.toString());
        }
        for (Chunk chunk : engine.chunk(DOCUMENT, ChunkingStrategy.SEMANTIC, 7, 3)) {
            assertTrue(chunk.getTokenCount() <= 7, chunk.toString());
        }
    }

    @Test
    void testSemanticPrefersParagraphBoundary() {
        String text = "One two three. Four five six seven.\n\nEight nine ten eleven twelve.";

        List<Chunk> chunks = engine.chunk(text, ChunkingStrategy.SEMANTIC, 8, 0);

        assertEquals(2, chunks.size());
        assertEquals("One two three. Four five six seven.", chunks.get(0).getText().trim());
        assertEquals("Eight nine ten eleven twelve.", chunks.get(1).getText());
    }

    @Test
    void testSemanticFallsBackToHardLimit() {
        List<Chunk> chunks = engine.chunk("a b c d e f g h i j", ChunkingStrategy.SEMANTIC, 5, 0);

        assertEquals(2, chunks.size());
        assertEquals(5, chunks.get(0).getTokenCount());
    }

    @Test
    void testHybridSnapsToNearestBoundary() {
        String text = "Alpha beta gamma delta epsilon. Zeta eta theta iota kappa. Lambda mu nu xi omicron.";

        List<Chunk> chunks = engine.chunk(text, ChunkingStrategy.HYBRID, 7, 0);

        assertEquals(2, chunks.size());
        assertEquals("Alpha beta gamma delta epsilon.", chunks.get(0).getText().trim());
        assertEquals(10, chunks.get(1).getTokenCount(), "May run past the limit to reach a boundary");
        for (Chunk chunk : engine.chunk(DOCUMENT, ChunkingStrategy.HYBRID, 6, 1)) {
            assertTrue(chunk.getTokenCount() <= 9, chunk.toString());
        }
    }

    @Test
    void testEmptyAndBlankText() {
        assertTrue(engine.chunk("", ChunkingStrategy.TOKEN, 10, 0).isEmpty());
        assertTrue(engine.chunk(null, ChunkingStrategy.HYBRID, 10, 0).isEmpty());

        List<Chunk> blank = engine.chunk(" \n\t ", ChunkingStrategy.SEMANTIC, 10, 0);
        assertEquals(1, blank.size());
        assertEquals(0, blank.get(0).getTokenCount());
        assertEquals(" \n\t ", ChunkingEngine.reconstruct(blank));
    }

    @Test
    void testSingleChunkWhenTextFits() {
        List<Chunk> chunks = engine.chunk("  short text  ", ChunkingStrategy.TOKEN, 10, 2);

        assertEquals(1, chunks.size());
        assertEquals("  short text  ", chunks.get(0).getText());
        assertEquals(2, chunks.get(0).getTokenCount());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> engine.chunk("text", ChunkingStrategy.TOKEN, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> engine.chunk("text", ChunkingStrategy.TOKEN, 5, 5));
        assertThrows(IllegalArgumentException.class, () -> engine.chunk("text", ChunkingStrategy.TOKEN, 5, -1));
        assertThrows(IllegalArgumentException.class, () -> engine.chunk("text", null, 5, 0));
    }

    @Test
    void testStrategyFromString() {
        assertEquals(ChunkingStrategy.HYBRID, ChunkingStrategy.fromString(" hybrid "));
        assertNull(ChunkingStrategy.fromString("random"));
        assertNull(ChunkingStrategy.fromString(null));
    }
}
