package com.othello.visualizer;

import com.othello.core.GameController;
import com.othello.core.GameOptions;
import com.othello.core.IllegalMoveException;
import com.othello.core.InvalidInputException;
import com.othello.core.TurnResult;
import com.othello.visualizer.model.GameFrame;
import com.othello.visualizer.ui.BoardView;
import com.othello.visualizer.ui.StatsPane;
import java.util.logging.Level;
import java.util.logging.Logger;
import javafx.application.Application;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.stage.Stage;

/**
 * JavaFX front-end for a two-player match on one screen. Clicking a highlighted square places a
 * disc for the side to move.
 */
public final class VisualizerApp extends Application {

    private static final Logger LOGGER = Logger.getLogger(VisualizerApp.class.getName());

    private final ObjectProperty<GameFrame> currentFrame = new SimpleObjectProperty<>();

    private GameOptions options = GameOptions.defaults();
    private GameController controller;
    private BoardView boardView;
    private StatsPane statsPane;
    private Button quitButton;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        configureOptions();

        boardView = new BoardView();
        boardView.setOnCellClicked(this::handleCellClicked);
        statsPane = new StatsPane();

        currentFrame.addListener((obs, oldFrame, newFrame) -> {
            boolean running = newFrame != null && !newFrame.snapshot().isTerminated();
            boardView.setInteractive(running);
            quitButton.setDisable(!running);
            boardView.update(newFrame);
            statsPane.update(newFrame);
        });

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(16));
        root.setCenter(boardView);
        BorderPane.setAlignment(boardView, Pos.CENTER);
        root.setRight(statsPane);
        BorderPane.setMargin(statsPane, new Insets(0, 0, 0, 16));

        HBox controls = buildControls();
        root.setBottom(controls);
        BorderPane.setMargin(controls, new Insets(16, 0, 0, 0));

        startNewGame();

        Scene scene = new Scene(root, 900, 700);
        stage.setTitle("Othello");
        stage.setScene(scene);
        stage.setMinWidth(720);
        stage.setMinHeight(560);
        stage.show();
    }

    private void configureOptions() {
        try {
            options = GameOptions.parse(getParameters().getRaw());
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Ignoring invalid arguments: " + ex.getMessage(), ex);
            LOGGER.warning(() -> GameOptions.usage("VisualizerApp"));
            options = GameOptions.defaults();
        }
    }

    private HBox buildControls() {
        Button newGameButton = new Button("New game");
        newGameButton.setOnAction(event -> startNewGame());

        quitButton = new Button("Quit game");
        quitButton.setOnAction(event -> quitGame());

        HBox controls = new HBox(12, newGameButton, quitButton);
        controls.setAlignment(Pos.CENTER_LEFT);
        return controls;
    }

    private void startNewGame() {
        controller = new GameController(options.boardSize());
        LOGGER.info(() -> "Started a new " + options.boardSize() + "x" + options.boardSize() + " game");
        currentFrame.set(GameFrame.initial(controller));
    }

    private void quitGame() {
        if (controller == null || !controller.isInProgress()) {
            return;
        }
        controller.quit();
        GameFrame frame = currentFrame.get();
        currentFrame.set(new GameFrame(controller.snapshot(), frame == null ? null : frame.lastMove(),
                null, GameFrame.describeResult(controller.snapshot())));
    }

    private void handleCellClicked(int index) {
        if (controller == null || !controller.isInProgress()) {
            return;
        }
        int size = controller.getBoardSize();
        try {
            TurnResult result = controller.play(index / size + 1, index % size);
            currentFrame.set(GameFrame.afterTurn(controller, result));
        } catch (IllegalMoveException | InvalidInputException ex) {
            LOGGER.fine(() -> "Rejected click on square " + index + ": " + ex.getMessage());
            GameFrame frame = currentFrame.get();
            if (frame != null) {
                currentFrame.set(frame.withMessage(ex.getMessage()));
            }
        }
    }
}
