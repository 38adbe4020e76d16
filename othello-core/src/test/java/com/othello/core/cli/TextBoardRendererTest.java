package com.othello.core.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.othello.core.Board;
import com.othello.core.GameController;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class TextBoardRendererTest {

    @Test
    void rendersLetteredGrid() {
        String expected = String.join(System.lineSeparator(),
                "    A   B   C   D",
                " 1|   |   |   |   |",
                " 2|   | W | B |   |",
                " 3|   | B | W |   |",
                " 4|   |   |   |   |",
                "");
        assertEquals(expected, TextBoardRenderer.render(Board.create(4)));
    }

    @Test
    void padsSingleDigitRowNumbers() {
        String rendered = TextBoardRenderer.render(Board.create(10));
        String[] lines = rendered.split(System.lineSeparator());
        assertEquals(11, lines.length);
        assertTrue(lines[1].startsWith(" 1|"));
        assertTrue(lines[10].startsWith("10|"));
        assertTrue(lines[0].endsWith("J"));
    }

    @Test
    void reportsFinalResult() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        TextBoardRenderer renderer = new TextBoardRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        GameController controller = new GameController();
        controller.play(4, 2);
        controller.quit();

        renderer.onGameOver(controller.snapshot());

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Final score: Black 4, White 1"), output);
        assertTrue(output.contains("Game abandoned."), output);
        assertTrue(output.contains("Winner: Black"), output);
    }

    @Test
    void labelsColumnsPastZ() {
        String[] lines = TextBoardRenderer.render(Board.create(28)).split(System.lineSeparator());
        assertEquals(29, lines.length);
        assertTrue(lines[0].contains(" Z   AA  AB"), lines[0]);
        assertEquals(lines[1].length(), lines[28].length());
    }

    @Test
    void widensRowLabelsForThreeDigitRows() {
        String[] lines = TextBoardRenderer.render(Board.create(100)).split(System.lineSeparator());
        assertTrue(lines[1].startsWith("  1|"), lines[1]);
        assertTrue(lines[100].startsWith("100|"), lines[100]);
        assertEquals(lines[0].indexOf('A'), lines[1].indexOf('|') + 2);
    }
}
