package nineflat.core.expressions;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Expressions travel as their textual form.
 */
final class ExpressionJson {

    private ExpressionJson() {
    }

    static class Serializer extends StdSerializer<Expression> {

        Serializer() {
            super(Expression.class);
        }

        @Override
        public void serialize(Expression value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toString());
        }
    }

    static class Deserializer extends StdDeserializer<Expression> {

        Deserializer() {
            super(Expression.class);
        }

        @Override
        public Expression deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken().isNumeric()) {
                return new Constant(p.getDoubleValue());
            }
            var text = p.getValueAsString();
            try {
                return Expression.parse(text);
            } catch (ExpressionParseException e) {
                return (Expression) ctxt.handleWeirdStringValue(Expression.class, text, e.getMessage());
            }
        }
    }
}
