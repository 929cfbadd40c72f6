package com.vidnyan.causeway.intervention;

import com.vidnyan.causeway.domain.error.InterventionParseException;
import com.vidnyan.causeway.domain.intervention.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Normalizes intervention requests into an {@link InterventionSpec}.
 * <p>
 * Accepted shapes:
 * <ul>
 *   <li>DSL text: {@code do(x=5)}, {@code do(x=x+2, y=y*0.5)}</li>
 *   <li>a map shaped like the JSON form of one intervention or of a whole spec;
 *       a single intervention without {@code type} is hard when it has {@code value}
 *       and soft when it has {@code transform}</li>
 *   <li>an {@link Intervention}, a list of them, or an {@link InterventionSpec}</li>
 * </ul>
 */
@Component
public class InterventionParser {

    private static final String DSL_PREFIX = "do(";

    /**
     * @throws InterventionParseException if the request has an unsupported type or is malformed
     */
    public InterventionSpec parse(Object request) {
        if (request instanceof InterventionSpec spec) {
            return spec;
        }
        if (request instanceof Intervention intervention) {
            return InterventionSpec.of(intervention);
        }
        if (request instanceof String text) {
            return parseDsl(text);
        }
        if (request instanceof Map<?, ?> map) {
            return parseMap(map);
        }
        if (request instanceof List<?> list && list.stream().allMatch(Intervention.class::isInstance)) {
            return InterventionSpec.of(list.stream().map(Intervention.class::cast).toList());
        }
        throw new InterventionParseException("Unsupported intervention format: "
                + (request == null ? "null" : request.getClass().getSimpleName()));
    }

    InterventionSpec parseDsl(String text) {
        String spec = text.strip();
        if (!spec.startsWith(DSL_PREFIX) || !spec.endsWith(")")) {
            throw new InterventionParseException("Intervention must be in format 'do(...)': " + spec);
        }
        String inner = spec.substring(DSL_PREFIX.length(), spec.length() - 1).strip();
        if (inner.isEmpty()) {
            throw new InterventionParseException("Empty intervention: " + spec);
        }

        List<Intervention> interventions = new ArrayList<>();
        for (String part : inner.split(",")) {
            int equals = part.indexOf('=');
            if (equals < 0) {
                throw new InterventionParseException("Invalid intervention syntax (missing '='): " + part.strip());
            }
            String node = part.substring(0, equals).strip();
            if (node.isEmpty()) {
                throw new InterventionParseException("Missing node name: " + part.strip());
            }
            interventions.add(parseValueExpression(node, part.substring(equals + 1).strip()));
        }
        return InterventionSpec.of(interventions);
    }

    /**
     * {@code k} is hard; {@code node+k}, {@code node-k}, {@code node*k}, {@code node/k} are
     * shift or scale; any other expression mentioning the node is custom.
     */
    Intervention parseValueExpression(String node, String expression) {
        if (!mentions(expression, node)) {
            return new HardIntervention(node, number(expression, "Invalid hard intervention value"));
        }

        String[] shift = splitOnce(expression, '+');
        if (shift != null && shift[0].equals(node)) {
            return SoftIntervention.shift(node, number(shift[1], "Invalid shift parameter"));
        }
        if (!expression.startsWith("-")) {
            String[] negativeShift = splitOnce(expression, '-');
            if (negativeShift != null && negativeShift[0].equals(node)) {
                return SoftIntervention.shift(node, -number(negativeShift[1], "Invalid shift parameter"));
            }
        }
        String[] scale = splitOnce(expression, '*');
        if (scale != null && scale[0].equals(node)) {
            return SoftIntervention.scale(node, number(scale[1], "Invalid scale parameter"));
        }
        String[] divide = splitOnce(expression, '/');
        if (divide != null && divide[0].equals(node)) {
            double divisor = number(divide[1], "Invalid scale parameter");
            if (divisor == 0.0) {
                throw new InterventionParseException("Invalid scale parameter: division by zero in " + expression);
            }
            return SoftIntervention.scale(node, 1.0 / divisor);
        }
        return SoftIntervention.custom(node, expression);
    }

    private InterventionSpec parseMap(Map<?, ?> map) {
        if (!map.containsKey("interventions")) {
            return InterventionSpec.of(toIntervention(map));
        }
        if (!(map.get("interventions") instanceof List<?> items)) {
            throw new InterventionParseException("'interventions' must be a list");
        }
        List<Intervention> interventions = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Intervention intervention) {
                interventions.add(intervention);
            } else if (item instanceof Map<?, ?> entry) {
                interventions.add(toIntervention(entry));
            } else {
                throw new InterventionParseException("Invalid intervention entry: " + item);
            }
        }

        List<String> queryNodes = null;
        Object query = map.get("query_nodes");
        if (query instanceof List<?> nodes) {
            queryNodes = nodes.stream().map(String::valueOf).toList();
        } else if (query != null) {
            throw new InterventionParseException("'query_nodes' must be a list");
        }

        int numSamples = InterventionSpec.DEFAULT_NUM_SAMPLES;
        Object samples = map.get("num_samples");
        if (samples instanceof Number n) {
            numSamples = n.intValue();
        } else if (samples != null) {
            throw new InterventionParseException("'num_samples' must be a number");
        }
        return new InterventionSpec(interventions, queryNodes, numSamples);
    }

    /**
     * @throws InterventionParseException for an unknown type or missing fields
     */
    Intervention toIntervention(Map<?, ?> data) {
        Object node = data.get("node");
        if (!(node instanceof String name) || name.isBlank()) {
            throw new InterventionParseException("Intervention requires a 'node' name: " + data);
        }

        Object type = data.get("type");
        if (type == null) {
            if (data.containsKey("value")) {
                type = "hard";
            } else if (data.containsKey("transform")) {
                type = "soft";
            }
        }

        if ("hard".equals(type)) {
            return new HardIntervention(name, number(data.get("value"), "Invalid hard intervention value"));
        }
        if ("soft".equals(type)) {
            Object transform = data.get("transform");
            if (transform == null) {
                throw new InterventionParseException("Soft intervention requires 'transform': " + data);
            }
            SoftTransform kind;
            try {
                kind = SoftTransform.fromLabel(transform.toString());
            } catch (IllegalArgumentException e) {
                throw new InterventionParseException("Unknown soft intervention transform: " + transform, e);
            }
            Object param = data.get("param");
            Object customExpr = data.get("custom_expr");
            SoftIntervention soft = new SoftIntervention(name, kind,
                    param == null ? null : number(param, "Invalid transform parameter"),
                    customExpr == null ? null : customExpr.toString());
            try {
                soft.describe();
            } catch (IllegalStateException e) {
                throw new InterventionParseException(e.getMessage(), e);
            }
            return soft;
        }
        throw new InterventionParseException("Unknown intervention type: " + type);
    }

    private static boolean mentions(String expression, String node) {
        return Pattern.compile("(?<![\\w.])" + Pattern.quote(node) + "(?![\\w])").matcher(expression).find();
    }

    private static String[] splitOnce(String expression, char operator) {
        int index = expression.indexOf(operator);
        if (index < 0 || expression.indexOf(operator, index + 1) >= 0) {
            return null;
        }
        return new String[] {expression.substring(0, index).strip(), expression.substring(index + 1).strip()};
    }

    private static double number(Object value, String error) {
        double parsed;
        if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else if (value instanceof String text) {
            try {
                parsed = Double.parseDouble(text.strip());
            } catch (NumberFormatException e) {
                throw new InterventionParseException(error + ": " + text, e);
            }
        } else {
            throw new InterventionParseException(error + ": " + value);
        }
        if (!Double.isFinite(parsed)) {
            throw new InterventionParseException(error + ": value must be finite, got " + value);
        }
        return parsed;
    }
}
