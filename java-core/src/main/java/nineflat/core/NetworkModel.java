package nineflat.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;

/**
 * The trait/interface for the input of the lowering pass.
 *
 * In essence, a network model is the hierarchical circuit description, or
 * pragmatically, a wrapper around whatever data types hold it. The only
 * requirement imposed on concrete network models is that their elements
 * (populations, selections, projections) have unique names, so that derived
 * outputs can be traced back to them.
 */
public interface NetworkModel {

    /**
     * @return The set of names of the elements in this model
     */
    default Set<String> elements() {
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
     * @return The format associated with this model, e.g. `json`.
     */
    default String format() {
        return "";
    }

    /**
     * @return this model as a string, when possible.
     */
    default Optional<String> asString() {
        try {
            return Optional.of(objectMapper.writeValueAsString(this));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * @return a short hex digest over category, format and element names
     */
    default Optional<String> fingerprint() {
        try {
            var sha2 = MessageDigest.getInstance("SHA-256");
            sha2.update(format().getBytes(StandardCharsets.UTF_8));
            sha2.update(category().getBytes(StandardCharsets.UTF_8));
            elements().stream().sorted().forEachOrdered(s -> sha2.update(s.getBytes(StandardCharsets.UTF_8)));
            return Optional.of(HexFormat.of().formatHex(sha2.digest(), 0, 8));
        } catch (NoSuchAlgorithmException e) {
            return Optional.empty();
        }
    }

    /**
     * The shared and static Jackson object mapper used for (de) serialization to
     * (from) JSON.
     */
    static final ObjectMapper objectMapper = new ObjectMapper().registerModule(new Jdk8Module());
}
