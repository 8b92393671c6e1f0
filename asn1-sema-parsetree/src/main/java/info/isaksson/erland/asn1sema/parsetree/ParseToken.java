package info.isaksson.erland.asn1sema.parsetree;

import java.util.Objects;

/** A raw scalar from the parser (identifier, keyword, number or string payload), kept as text. */
public final class ParseToken extends ParseElement {
    public final String text;

    public ParseToken(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        this.text = text;
    }

    public static ParseToken of(String text) {
        return new ParseToken(text);
    }

    public static ParseToken of(long number) {
        return new ParseToken(Long.toString(number));
    }

    @Override
    public boolean isToken() {
        return true;
    }

    @Override
    public boolean isToken(String literal) {
        return text.equals(literal);
    }

    @Override
    public ParseToken asToken() {
        return this;
    }

    @Override
    String describe() {
        return "token '" + text + "'";
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseToken)) return false;
        return text.equals(((ParseToken) o).text);
    }

    @Override public int hashCode() {
        return Objects.hash(text);
    }

    @Override public String toString() {
        return text;
    }
}
