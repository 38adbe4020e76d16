package com.othello.visualizer.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.othello.core.GameController;
import com.othello.core.TurnResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class GameFrameTest {

    @Test
    void initialFrameListsOpeningMoves() {
        GameFrame frame = GameFrame.initial(new GameController());
        assertFalse(frame.hasLastMove());
        assertEquals(List.of(19, 26, 37, 44), frame.legalTargets());
        assertTrue(frame.isLegalTarget(26));
        assertFalse(frame.isLegalTarget(0));
        assertEquals("Black to move", frame.message());
    }

    @Test
    void initialFrameFollowsControllerPosition() {
        GameController controller = new GameController();
        controller.play(4, 2);
        GameFrame frame = GameFrame.initial(controller);
        assertEquals("White to move", frame.message());
        assertEquals(List.of(18, 20, 34), frame.legalTargets());

        controller.quit();
        GameFrame finished = GameFrame.initial(controller);
        assertEquals("Game abandoned. Black wins 4 to 1", finished.message());
        assertTrue(finished.legalTargets().isEmpty());
    }

    @Test
    void frameAfterTurnMarksPlacementAndFlips() {
        GameController controller = new GameController();
        TurnResult result = controller.play(4, 2);
        GameFrame frame = GameFrame.afterTurn(controller, result);

        assertTrue(frame.hasLastMove());
        assertEquals(26, frame.lastMove().targetIndex());
        assertTrue(frame.wasFlipped(27));
        assertFalse(frame.wasFlipped(28));
        assertEquals("White to move", frame.message());
        assertEquals(List.of(18, 20, 34), frame.legalTargets());
    }

    @Test
    void describesFinishedGame() {
        GameController controller = new GameController();
        controller.play(4, 2);
        controller.quit();
        assertEquals("Game abandoned. Black wins 4 to 1", GameFrame.describeResult(controller.snapshot()));
    }

    @Test
    void withMessageKeepsPosition() {
        GameFrame frame = GameFrame.initial(new GameController());
        GameFrame updated = frame.withMessage("Black cannot play a1: square does not capture any disc");
        assertEquals(frame.snapshot(), updated.snapshot());
        assertEquals(frame.legalTargets(), updated.legalTargets());
        assertTrue(updated.message().startsWith("Black cannot play a1"));
    }
}
