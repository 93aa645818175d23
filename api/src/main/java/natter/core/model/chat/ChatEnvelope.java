package natter.core.model.chat;

/**
 * Outbound unit delivered to every recipient of a broadcast.
 *
 * @param message rendered text, {@code "<display name>: <text>"}
 * @param color   sender color as {@code #rrggbb}
 */
public record ChatEnvelope(String message, String color) {

    /**
     * Render a sender's text into an envelope.
     *
     * @param sender identity of the sender
     * @param color  color of the sender
     * @param text   raw chat text as received
     * @return the envelope
     */
    public static ChatEnvelope render(ChatIdentity sender, PresentationColor color, String text) {
        return new ChatEnvelope(sender.displayName() + ": " + text, color.hex());
    }
}
