package xyz.jphil.imgpdf.tools.crop;

import javax.swing.JPanel;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Cursor;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.image.BufferedImage;

/**
 * Paints the preview with the crop overlay and forwards pointer events to a {@link CropSelector}.
 */
public class CropCanvas extends JPanel {

    private static final Color HANDLE_COLOR = new Color(0x0078d4);
    private static final Color BORDER_COLOR = new Color(0x0078d4);
    private static final Color OVERLAY_COLOR = new Color(0, 0, 0, 128);

    private final BufferedImage preview;
    private final CropSelector selector;
    private final Runnable onSelectionChanged;

    public CropCanvas(BufferedImage preview, CropSelector selector, Runnable onSelectionChanged) {
        this.preview = preview;
        this.selector = selector;
        this.onSelectionChanged = onSelectionChanged;
        setPreferredSize(new Dimension(selector.displayWidth(), selector.displayHeight()));

        var mouse = new MouseAdapter() {
            @Override
            public void mousePressed(MouseEvent e) {
                selector.beginDrag(selector.hitTest(e.getX(), e.getY()), e.getX(), e.getY());
            }

            @Override
            public void mouseDragged(MouseEvent e) {
                if (!selector.dragging()) return;
                selector.updateDrag(e.getX(), e.getY());
                selectionChanged();
            }

            @Override
            public void mouseReleased(MouseEvent e) {
                selector.endDrag();
            }

            @Override
            public void mouseMoved(MouseEvent e) {
                var handle = selector.hitTest(e.getX(), e.getY());
                setCursor(handle != null ? Cursor.getPredefinedCursor(handle.cursorType()) : Cursor.getDefaultCursor());
            }
        };
        addMouseListener(mouse);
        addMouseMotionListener(mouse);
    }

    public void resetSelection() {
        selector.reset();
        selectionChanged();
    }

    private void selectionChanged() {
        repaint();
        if (onSelectionChanged != null) onSelectionChanged.run();
    }

    @Override
    protected void paintComponent(Graphics g) {
        super.paintComponent(g);
        var g2 = (Graphics2D) g.create();
        try {
            g2.drawImage(preview, 0, 0, null);
            paintOverlay(g2, selector.selection(), selector.displayWidth(), selector.displayHeight());
        } finally {
            g2.dispose();
        }
    }

    private static void paintOverlay(Graphics2D g, SelectionRect r, int width, int height) {
        // dim everything outside the selection
        g.setColor(OVERLAY_COLOR);
        g.fillRect(0, 0, width, r.y1());
        g.fillRect(0, r.y2(), width, height - r.y2());
        g.fillRect(0, r.y1(), r.x1(), r.height());
        g.fillRect(r.x2(), r.y1(), width - r.x2(), r.height());

        g.setColor(BORDER_COLOR);
        g.setStroke(new BasicStroke(2));
        g.drawRect(r.x1(), r.y1(), r.width(), r.height());

        int hs = CropSelector.HANDLE_SIZE / 2;
        int[][] handles = {
            {r.x1(), r.y1()}, {r.x2(), r.y1()}, {r.x1(), r.y2()}, {r.x2(), r.y2()},
            {r.midX(), r.y1()}, {r.midX(), r.y2()}, {r.x1(), r.midY()}, {r.x2(), r.midY()}
        };
        g.setStroke(new BasicStroke(1));
        for (var h : handles) {
            g.setColor(HANDLE_COLOR);
            g.fillRect(h[0] - hs, h[1] - hs, hs * 2, hs * 2);
            g.setColor(Color.WHITE);
            g.drawRect(h[0] - hs, h[1] - hs, hs * 2, hs * 2);
        }
    }
}
