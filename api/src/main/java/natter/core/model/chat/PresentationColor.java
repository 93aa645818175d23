package natter.core.model.chat;

import java.util.concurrent.ThreadLocalRandom;

/**
 * RGB color assigned to a connection at admission, used only for client-side rendering.
 *
 * @param rgb 24-bit RGB value
 */
public record PresentationColor(int rgb) {

    private static final int MAX_RGB = 0xFFFFFF;

    /**
     * Color used for messages whose sender could not be resolved.
     */
    public static final PresentationColor BLACK = new PresentationColor(0);

    public PresentationColor {
        if (rgb < 0 || rgb > MAX_RGB) {
            throw new IllegalArgumentException("rgb must be between 0x000000 and 0xFFFFFF, got " + rgb);
        }
    }

    /**
     * Pick a uniformly random color.
     */
    public static PresentationColor random() {
        return new PresentationColor(ThreadLocalRandom.current().nextInt(MAX_RGB + 1));
    }

    /**
     * Render as {@code #rrggbb}.
     */
    public String hex() {
        return String.format("#%06x", rgb);
    }
}
