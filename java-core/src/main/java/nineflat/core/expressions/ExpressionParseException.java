package nineflat.core.expressions;

public class ExpressionParseException extends IllegalArgumentException {

    private final String text;
    private final int position;

    public ExpressionParseException(String message, String text, int position) {
        super("%s at position %d of '%s'".formatted(message, position, text));
        this.text = text;
        this.position = position;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }
}
