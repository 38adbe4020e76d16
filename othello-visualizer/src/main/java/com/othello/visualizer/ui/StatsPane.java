package com.othello.visualizer.ui;

import com.othello.core.GameSnapshot;
import com.othello.core.Notation;
import com.othello.visualizer.model.GameFrame;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;

/**
 * Displays the score and turn information of the current frame.
 */
public final class StatsPane extends VBox {

    private static final String PLACEHOLDER = "-";

    private final Label turnValue = valueLabel();
    private final Label activeValue = valueLabel();
    private final Label blackValue = valueLabel();
    private final Label whiteValue = valueLabel();
    private final Label statusValue = valueLabel();
    private final Label lastMoveValue = valueLabel();
    private final Label messageValue = valueLabel();

    public StatsPane() {
        setPadding(new Insets(16));
        setSpacing(12);
        setStyle("-fx-background-color: rgba(255,255,255,0.85); -fx-border-color: #d0d6e6; -fx-border-radius: 6; -fx-background-radius: 6;");
        setPrefWidth(260);
        setMinWidth(260);
        setMaxWidth(260);

        Label title = new Label("Game");
        title.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);

        addRow(grid, 0, "Turn", turnValue);
        addRow(grid, 1, "To move", activeValue);
        addRow(grid, 2, "Black", blackValue);
        addRow(grid, 3, "White", whiteValue);
        addRow(grid, 4, "Status", statusValue);
        addRow(grid, 5, "Last move", lastMoveValue);

        messageValue.setWrapText(true);
        messageValue.setStyle("-fx-font-style: italic;");

        getChildren().addAll(title, grid, messageValue);
    }

    public void update(GameFrame frame) {
        if (frame == null) {
            turnValue.setText(PLACEHOLDER);
            activeValue.setText(PLACEHOLDER);
            blackValue.setText(PLACEHOLDER);
            whiteValue.setText(PLACEHOLDER);
            statusValue.setText(PLACEHOLDER);
            lastMoveValue.setText(PLACEHOLDER);
            messageValue.setText("");
            return;
        }

        GameSnapshot snapshot = frame.snapshot();
        turnValue.setText(String.valueOf(snapshot.turnNumber()));
        activeValue.setText(snapshot.isTerminated() ? PLACEHOLDER : snapshot.activePlayer().toString());
        blackValue.setText(String.valueOf(snapshot.blackCount()));
        whiteValue.setText(String.valueOf(snapshot.whiteCount()));
        statusValue.setText(snapshot.isTerminated() ? "Finished" : "In progress");
        if (frame.hasLastMove()) {
            lastMoveValue.setText(String.format("%s (%s, %d flipped)",
                    Notation.label(frame.lastMove().targetIndex(), snapshot.board()),
                    frame.lastMove().player(), frame.lastMove().captureCount()));
        } else {
            lastMoveValue.setText(PLACEHOLDER);
        }
        messageValue.setText(frame.message());
    }

    private static void addRow(GridPane grid, int row, String name, Node value) {
        Label label = new Label(name);
        label.setStyle("-fx-text-fill: #5a6270;");
        grid.add(label, 0, row);
        grid.add(value, 1, row);
    }

    private static Label valueLabel() {
        Label label = new Label();
        label.setStyle("-fx-font-weight: bold;");
        return label;
    }
}
