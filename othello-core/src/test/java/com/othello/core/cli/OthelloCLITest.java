package com.othello.core.cli;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class OthelloCLITest {

    @Test
    void playsScriptedMatchFromStandardInput() {
        InputStream originalIn = System.in;
        PrintStream originalOut = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            System.setIn(new ByteArrayInputStream("c4\nd4\ne3\nq\n".getBytes(StandardCharsets.UTF_8)));
            System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));

            OthelloCLI.main(new String[] {"--size=8"});
        } finally {
            System.setIn(originalIn);
            System.setOut(originalOut);
        }

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Black played c4 and flipped 1"), output);
        assertTrue(output.contains("Invalid move: White cannot play d4: square is already occupied"), output);
        assertTrue(output.contains("White played e3 and flipped 1"), output);
        assertTrue(output.contains("Game abandoned."), output);
    }
}
