package com.othello.visualizer.ui;

import com.othello.core.Notation;
import com.othello.core.SquareStatus;
import com.othello.visualizer.model.GameFrame;
import java.util.Locale;
import java.util.function.IntConsumer;
import javafx.geometry.Insets;
import javafx.geometry.VPos;
import javafx.scene.Group;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import javafx.scene.paint.Paint;
import javafx.scene.shape.Circle;
import javafx.scene.shape.Rectangle;
import javafx.scene.text.Font;
import javafx.scene.text.Text;
import javafx.scene.text.TextAlignment;

/**
 * Visual representation of the Othello board: a green grid of squares with black and white discs.
 */
public final class BoardView extends Pane {

    private static final double CELL_SIZE = 56.0;
    private static final double DISC_RADIUS = CELL_SIZE * 0.4;
    private static final double LABEL_MARGIN = 22.0;
    private static final Paint BOARD_FILL = Color.web("#2E7D32");
    private static final Paint GRID_STROKE = Color.web("#1B5E20");
    private static final Paint AVAILABLE_FILL = Color.web("#66BB6A");
    private static final Paint BLACK_FILL = Color.web("#212121");
    private static final Paint WHITE_FILL = Color.web("#FAFAFA");
    private static final Paint DISC_STROKE = Color.web("#424242");
    private static final Paint LAST_MOVE_STROKE = Color.web("#FFB300");
    private static final Paint FLIPPED_STROKE = Color.web("#FFE082");
    private static final double DEFAULT_STROKE_WIDTH = 1.0;
    private static final double HIGHLIGHT_STROKE_WIDTH = 3.0;

    private final Group boardGroup = new Group();
    private Rectangle[] cells = new Rectangle[0];
    private Circle[] discs = new Circle[0];
    private int size;
    private boolean interactive;
    private IntConsumer onCellClicked = index -> { };

    public BoardView() {
        setPadding(new Insets(16));
        setStyle("-fx-background-color: linear-gradient(to bottom, #fdfdfd, #e7ebf5);");
        getChildren().add(boardGroup);
        setMinSize(0, 0);
        setMaxSize(Double.MAX_VALUE, Double.MAX_VALUE);
    }

    /**
     * Rebuilds the grid for a board with the provided edge length.
     */
    public void configure(int boardSize) {
        if (boardSize == size) {
            return;
        }
        size = boardSize;
        boardGroup.getChildren().clear();
        cells = new Rectangle[size * size];
        discs = new Circle[size * size];

        for (int row = 0; row < size; row++) {
            for (int column = 0; column < size; column++) {
                int index = row * size + column;
                double x = LABEL_MARGIN + column * CELL_SIZE;
                double y = LABEL_MARGIN + row * CELL_SIZE;

                Rectangle cell = new Rectangle(x, y, CELL_SIZE, CELL_SIZE);
                cell.setFill(BOARD_FILL);
                cell.setStroke(GRID_STROKE);
                cell.setStrokeWidth(DEFAULT_STROKE_WIDTH);
                cell.setOnMouseClicked(event -> handleClick(index));
                cells[index] = cell;

                Circle disc = new Circle(x + CELL_SIZE / 2.0, y + CELL_SIZE / 2.0, DISC_RADIUS);
                disc.setVisible(false);
                disc.setMouseTransparent(true);
                discs[index] = disc;

                boardGroup.getChildren().addAll(cell, disc);
            }
        }
        addCoordinateLabels();

        double extent = LABEL_MARGIN + size * CELL_SIZE + 16;
        setPrefSize(extent + 32, extent + 32);
        requestLayout();
    }

    /**
     * Redraws discs, legal targets and last-move marks for the provided frame.
     */
    public void update(GameFrame frame) {
        if (frame == null) {
            for (int index = 0; index < cells.length; index++) {
                cells[index].setFill(BOARD_FILL);
                discs[index].setVisible(false);
            }
            return;
        }
        configure(frame.snapshot().size());

        for (int index = 0; index < cells.length; index++) {
            boolean available = interactive && frame.isLegalTarget(index);
            cells[index].setFill(available ? AVAILABLE_FILL : BOARD_FILL);

            Circle disc = discs[index];
            SquareStatus status = frame.snapshot().status(index);
            if (status == SquareStatus.EMPTY) {
                disc.setVisible(false);
                continue;
            }
            disc.setFill(status == SquareStatus.BLACK ? BLACK_FILL : WHITE_FILL);
            if (frame.hasLastMove() && frame.lastMove().targetIndex() == index) {
                disc.setStroke(LAST_MOVE_STROKE);
                disc.setStrokeWidth(HIGHLIGHT_STROKE_WIDTH);
            } else if (frame.wasFlipped(index)) {
                disc.setStroke(FLIPPED_STROKE);
                disc.setStrokeWidth(HIGHLIGHT_STROKE_WIDTH);
            } else {
                disc.setStroke(DISC_STROKE);
                disc.setStrokeWidth(DEFAULT_STROKE_WIDTH);
            }
            disc.setVisible(true);
        }
    }

    public void setInteractive(boolean interactive) {
        this.interactive = interactive;
    }

    /**
     * Registers the handler that receives the row-major index of a clicked square.
     */
    public void setOnCellClicked(IntConsumer handler) {
        this.onCellClicked = handler == null ? index -> { } : handler;
    }

    @Override
    protected void layoutChildren() {
        super.layoutChildren();
        var insets = getInsets();
        var bounds = boardGroup.getLayoutBounds();
        double availableWidth = getWidth() - insets.getLeft() - insets.getRight();
        double availableHeight = getHeight() - insets.getTop() - insets.getBottom();
        double offsetX = insets.getLeft() + (availableWidth - bounds.getWidth()) / 2.0;
        double offsetY = insets.getTop() + (availableHeight - bounds.getHeight()) / 2.0;
        boardGroup.relocate(offsetX, offsetY);
    }

    private void handleClick(int index) {
        if (interactive) {
            onCellClicked.accept(index);
        }
    }

    private void addCoordinateLabels() {
        for (int i = 0; i < size; i++) {
            double center = LABEL_MARGIN + i * CELL_SIZE + CELL_SIZE / 2.0;
            String name = Notation.columnName(i).toUpperCase(Locale.ROOT);
            Text columnLabel = label(name);
            columnLabel.setX(center - 5 * name.length());
            columnLabel.setY(LABEL_MARGIN / 2.0);
            Text rowLabel = label(String.valueOf(i + 1));
            rowLabel.setX(2);
            rowLabel.setY(center);
            boardGroup.getChildren().addAll(columnLabel, rowLabel);
        }
    }

    private static Text label(String value) {
        Text text = new Text(value);
        text.setFont(Font.font(13));
        text.setFill(Color.rgb(90, 98, 112));
        text.setTextOrigin(VPos.CENTER);
        text.setTextAlignment(TextAlignment.CENTER);
        text.setMouseTransparent(true);
        return text;
    }
}
