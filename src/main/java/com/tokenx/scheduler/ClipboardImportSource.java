package com.tokenx.scheduler;

import com.tokenx.AppLogger;

import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.io.IOException;
import java.util.Optional;

/**
 * Reads plain text from the AWT system clipboard.
 */
public class ClipboardImportSource implements ImportSource {

    private final Clipboard clipboard;
    private final AppLogger logger = AppLogger.get();
    private boolean warned;

    private ClipboardImportSource(Clipboard clipboard) {
        this.clipboard = clipboard;
    }

    /**
     * @return the system clipboard source, or null when running headless
     */
    public static ClipboardImportSource system() {
        if (GraphicsEnvironment.isHeadless()) {
            return null;
        }
        try {
            return new ClipboardImportSource(Toolkit.getDefaultToolkit().getSystemClipboard());
        } catch (HeadlessException e) {
            return null;
        }
    }

    @Override
    public Optional<String> poll() {
        try {
            if (!clipboard.isDataFlavorAvailable(DataFlavor.stringFlavor)) {
                return Optional.empty();
            }
            Object data = clipboard.getData(DataFlavor.stringFlavor);
            return data instanceof String ? Optional.of(((String) data).trim()) : Optional.empty();
        } catch (IllegalStateException | UnsupportedFlavorException | IOException e) {
            // clipboard is busy or changed owner between the two calls
            if (!warned && logger != null) {
                logger.warn("[ClipboardImportSource] Clipboard not readable: " + e.getMessage());
                warned = true;
            }
            return Optional.empty();
        }
    }

    @Override
    public String getName() {
        return "clipboard";
    }
}
