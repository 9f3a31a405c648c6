package xyz.jphil.imgpdf.tools.crop;

import xyz.jphil.imgpdf.tools.image.ImageOps;

import javax.swing.BorderFactory;
import javax.swing.BoxLayout;
import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.SwingUtilities;
import java.awt.BorderLayout;
import java.awt.Component;
import java.awt.FlowLayout;
import java.awt.Frame;
import java.awt.image.BufferedImage;
import java.lang.reflect.InvocationTargetException;
import java.util.Optional;

/**
 * Modal crop window: preview with draggable selection, Reset / Crop / Cancel.
 * Yields the selection in source pixels, or empty when the user cancels or closes the window.
 */
public class CropDialog extends JDialog {

    private final CropSelector selector;
    private final JLabel selectionLabel = new JLabel();
    private SelectionRect result;

    private CropDialog(Frame owner, String fileName, BufferedImage image, CropSelector selector) {
        super(owner, "Crop Image", true);
        this.selector = selector;
        setDefaultCloseOperation(DISPOSE_ON_CLOSE);

        var preview = ImageOps.resize(image, selector.displayWidth(), selector.displayHeight());
        var canvas = new CropCanvas(preview, selector, this::updateSelectionLabel);

        var info = new JPanel();
        info.setLayout(new BoxLayout(info, BoxLayout.Y_AXIS));
        info.setBorder(BorderFactory.createEmptyBorder(10, 10, 5, 10));
        info.add(centered(new JLabel(String.format("File: %s | Original: %d x %d px",
            fileName, image.getWidth(), image.getHeight()))));
        info.add(centered(new JLabel("Drag the handles or edges to adjust the crop area")));
        info.add(centered(selectionLabel));
        updateSelectionLabel();

        var canvasHolder = new JPanel(new FlowLayout(FlowLayout.CENTER));
        canvasHolder.add(canvas);

        var reset = new JButton("Reset");
        reset.addActionListener(e -> canvas.resetSelection());
        var crop = new JButton("Crop & Save");
        crop.addActionListener(e -> {
            result = selector.finalizeSelection();
            dispose();
        });
        var cancel = new JButton("Cancel");
        cancel.addActionListener(e -> {
            result = null;
            dispose();
        });
        var buttons = new JPanel(new FlowLayout(FlowLayout.CENTER));
        buttons.add(reset);
        buttons.add(crop);
        buttons.add(cancel);

        setLayout(new BorderLayout());
        add(info, BorderLayout.NORTH);
        add(canvasHolder, BorderLayout.CENTER);
        add(buttons, BorderLayout.SOUTH);
        setResizable(false);
        pack();
        setLocationRelativeTo(owner);
    }

    private static Component centered(JLabel label) {
        label.setAlignmentX(Component.CENTER_ALIGNMENT);
        return label;
    }

    private void updateSelectionLabel() {
        var size = selector.sourceSelectionSize();
        selectionLabel.setText(String.format("Crop Size: %d x %d px", size[0], size[1]));
    }

    /**
     * Shows the dialog on the event thread and blocks until it closes.
     */
    public static Optional<SelectionRect> showDialog(String fileName, BufferedImage image, int maxPreviewWidth, int maxPreviewHeight)
            throws InterruptedException {
        var selector = new CropSelector(image.getWidth(), image.getHeight(), maxPreviewWidth, maxPreviewHeight);
        var holder = new SelectionRect[1];
        try {
            SwingUtilities.invokeAndWait(() -> {
                var dialog = new CropDialog(null, fileName, image, selector);
                dialog.setVisible(true);
                holder[0] = dialog.result;
            });
        } catch (InvocationTargetException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Crop dialog failed", cause);
        }
        return Optional.ofNullable(holder[0]);
    }
}
