package helios.panelcal.ui;

import helios.panelcal.model.CaptureEvent;
import helios.panelcal.model.CaptureEventSource;
import helios.panelcal.model.CaptureState;
import helios.panelcal.model.PixelPoint;
import helios.panelcal.model.RasterStack;
import helios.panelcal.service.CaptureEventSourceFactory;
import javafx.application.Platform;
import javafx.event.EventHandler;
import javafx.scene.Scene;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.control.Label;
import javafx.scene.image.PixelWriter;
import javafx.scene.image.WritableImage;
import javafx.scene.input.KeyCode;
import javafx.scene.input.KeyEvent;
import javafx.scene.input.MouseButton;
import javafx.scene.input.MouseEvent;
import javafx.scene.layout.BorderPane;
import javafx.scene.paint.Color;
import javafx.stage.Stage;
import javafx.stage.WindowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.ResourceBundle;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PolygonCaptureWindow - JavaFX window for marking the reflectance panel on a raster
 *
 * <p>Shows the first band, normalized to its value range, as a grayscale image. Left clicks
 * add vertices, ENTER commits the polygon, and closing the window ends the capture without
 * a polygon. Events are handed to the capture session through a blocking queue, so the
 * session runs on the calling thread while the window lives on the JavaFX thread.</p>
 *
 * <p>The JavaFX toolkit must already be running, see {@code PanelCalibrationLauncher}.</p>
 *
 * @since 0.1.0
 * @author helios-panelcal contributors
 */
public class PolygonCaptureWindow implements CaptureEventSourceFactory {
    private static final Logger logger = LoggerFactory.getLogger(PolygonCaptureWindow.class);

    private static final double MAX_VIEW_SIZE = 1000.0;

    private final ResourceBundle res = ResourceBundle.getBundle("helios.panelcal.ui.strings");

    @Override
    public CaptureEventSource open(Path file, RasterStack raster) {
        WindowEventSource events = new WindowEventSource();
        Platform.runLater(() -> events.show(file, raster));
        return events;
    }

    /**
     * Converts band 1 to a grayscale image scaled to [0, 1]. NaN pixels are drawn black.
     */
    static WritableImage toGrayImage(float[][] band) {
        int height = band.length;
        int width = band[0].length;
        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for (float[] row : band) {
            for (float v : row) {
                if (Float.isFinite(v)) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
        }
        float range = (max > min) ? max - min : 1f;
        if (!Float.isFinite(min)) min = 0f;

        WritableImage image = new WritableImage(width, height);
        PixelWriter writer = image.getPixelWriter();
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                float v = band[r][c];
                double gray = Float.isFinite(v) ? Math.max(0, Math.min(1, (v - min) / range)) : 0;
                writer.setColor(c, r, Color.gray(gray));
            }
        }
        return image;
    }

    /**
     * Event source bound to one window. The session reads from the calling thread; the
     * window pushes events from the JavaFX thread.
     */
    private class WindowEventSource implements CaptureEventSource {
        // marks the end of the stream (window closed)
        private final CaptureEvent endOfStream = CaptureEvent.commit();

        private final BlockingQueue<CaptureEvent> queue = new LinkedBlockingQueue<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private CaptureEvent pending;
        private boolean ended;

        private Stage stage;
        private Canvas canvas;
        private WritableImage image;
        private Label status;
        private double scale = 1.0;
        private EventHandler<MouseEvent> clickHandler;
        private EventHandler<KeyEvent> keyHandler;

        void show(Path file, RasterStack raster) {
            if (closed.get()) {
                return;
            }
            image = toGrayImage(raster.getBand(0));
            scale = Math.min(1.0, MAX_VIEW_SIZE / Math.max(raster.getWidth(), raster.getHeight()));
            canvas = new Canvas(raster.getWidth() * scale, raster.getHeight() * scale);
            status = new Label(res.getString("capture.status.empty"));

            clickHandler = e -> {
                if (e.getButton() == MouseButton.PRIMARY) {
                    double x = e.getX() / scale;
                    double y = e.getY() / scale;
                    logger.debug("Click at view ({}, {}) -> pixel ({}, {})", e.getX(), e.getY(), x, y);
                    queue.offer(CaptureEvent.click(x, y));
                }
            };
            keyHandler = e -> {
                if (e.getCode() == KeyCode.ENTER) {
                    logger.debug("ENTER pressed; committing polygon");
                    queue.offer(CaptureEvent.commit());
                }
            };
            canvas.addEventHandler(MouseEvent.MOUSE_CLICKED, clickHandler);

            BorderPane root = new BorderPane(canvas);
            root.setBottom(status);
            Scene scene = new Scene(root);
            scene.addEventHandler(KeyEvent.KEY_PRESSED, keyHandler);

            stage = new Stage();
            stage.setTitle(MessageFormat.format(res.getString("capture.title"), file.getFileName()));
            stage.setScene(scene);
            stage.setOnCloseRequest((WindowEvent e) -> {
                logger.info("Capture window closed by user");
                queue.offer(endOfStream);
            });
            redraw(List.of());
            stage.show();
            canvas.requestFocus();
        }

        private void redraw(List<PixelPoint> polygon) {
            GraphicsContext g = canvas.getGraphicsContext2D();
            g.drawImage(image, 0, 0, canvas.getWidth(), canvas.getHeight());
            g.setStroke(Color.RED);
            g.setFill(Color.RED);
            g.setLineWidth(2);
            for (int i = 0; i < polygon.size(); i++) {
                PixelPoint p = polygon.get(i);
                g.fillOval(p.x() * scale - 3, p.y() * scale - 3, 6, 6);
                if (i > 0) {
                    PixelPoint prev = polygon.get(i - 1);
                    g.strokeLine(prev.x() * scale, prev.y() * scale, p.x() * scale, p.y() * scale);
                }
            }
        }

        @Override
        public boolean hasNext() {
            if (ended) {
                return false;
            }
            if (pending != null) {
                return true;
            }
            try {
                CaptureEvent event = queue.take();
                if (event == endOfStream) {
                    ended = true;
                    return false;
                }
                pending = event;
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for capture events");
                ended = true;
                return false;
            }
        }

        @Override
        public CaptureEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Capture window closed");
            }
            CaptureEvent event = pending;
            pending = null;
            return event;
        }

        @Override
        public void onProgress(CaptureState state, List<PixelPoint> polygon) {
            Platform.runLater(() -> {
                if (canvas == null) {
                    return;
                }
                redraw(polygon);
                status.setText(switch (state) {
                    case EMPTY -> res.getString("capture.status.empty");
                    case DRAWING -> MessageFormat.format(res.getString("capture.status.drawing"), polygon.size());
                    case CLOSED -> res.getString("capture.status.closed");
                });
            });
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            ended = true;
            Platform.runLater(() -> {
                if (stage == null) {
                    return;
                }
                canvas.removeEventHandler(MouseEvent.MOUSE_CLICKED, clickHandler);
                stage.getScene().removeEventHandler(KeyEvent.KEY_PRESSED, keyHandler);
                stage.setOnCloseRequest(null);
                stage.close();
                logger.debug("Capture window released");
            });
        }
    }
}
