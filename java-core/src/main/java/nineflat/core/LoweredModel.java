package nineflat.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * The trait/interface for anything produced by lowering a network: component
 * arrays, connection groups and the flattened network holding both.
 *
 * A lowered model is what gets handed to a simulator backend. Beyond its
 * content, it only has to tell which elements of the original network it
 * covers, so that a backend can check that nothing was dropped on the way.
 */
public interface LoweredModel {

    /**
     * @return The names of the populations, projections and ports this model
     *         was derived from.
     */
    default Set<String> part() {
        return Set.of();
    }

    /**
     * @return The category that describes this model. Default value (and
     *         recommendation) is the class name.
     */
    default String category() {
        return getClass().getSimpleName();
    }

    /**
     * @return The "body" of the model as a string, when possible.
     */
    default Optional<String> asJsonString() {
        try {
            return Optional.of(objectMapper.writeValueAsString(this));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * @return The "body" of the model as a CBOR byte array, when possible.
     */
    default Optional<byte[]> asCBORBinary() {
        try {
            return Optional.of(objectMapperCBOR.writeValueAsBytes(this));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    static <T extends LoweredModel> Optional<T> fromCBOR(byte[] bytes, Class<T> cls) {
        try {
            return Optional.of(objectMapperCBOR.readValue(bytes, cls));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    static <T extends LoweredModel> Optional<T> fromJsonString(String str, Class<T> cls) {
        try {
            return Optional.of(objectMapper.readValue(str, cls));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    /**
     * The shared and static Jackson object mapper used for (de) serialization to
     * (from) JSON.
     */
    static ObjectMapper objectMapper = new ObjectMapper().registerModule(new Jdk8Module())
            .enable(SerializationFeature.INDENT_OUTPUT);
    /**
     * The shared and static Jackson object mapper used for (de) serialization to
     * (from) CBOR.
     */
    static ObjectMapper objectMapperCBOR = new ObjectMapper(new CBORFactory()).registerModule(new Jdk8Module());
}
