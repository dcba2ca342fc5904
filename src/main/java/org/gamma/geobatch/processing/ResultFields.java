package org.gamma.geobatch.processing;

import org.gamma.geobatch.model.Bounds;
import org.gamma.geobatch.model.GeocodeResult;
import org.gamma.geobatch.model.Geometry;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves dotted paths such as {@code geometry.lat} or {@code components.country} against a result.
 * Unknown or absent paths resolve to empty.
 */
public final class ResultFields {

    private ResultFields() {
    }

    public static Optional<Object> lookup(final GeocodeResult result, final String path) {
        if (result == null || path == null || path.isBlank()) return Optional.empty();
        final String[] keys = path.strip().split("\\.", -1);
        Object current = topLevel(result, keys[0]);
        for (int i = 1; i < keys.length && current != null; i++) {
            current = child(current, keys[i]);
        }
        return Optional.ofNullable(current);
    }

    private static Object topLevel(final GeocodeResult r, final String key) {
        return switch (key) {
            case "formatted" -> r.formatted();
            case "confidence" -> r.confidence();
            case "geometry" -> r.geometry();
            case "bounds" -> r.bounds();
            case "components" -> r.components();
            case "annotations" -> r.annotations();
            case "distance_from_q" -> r.distanceFromQ();
            default -> null;
        };
    }

    private static Object child(final Object node, final String key) {
        if (node instanceof Map<?, ?> map) {
            return map.get(key);
        }
        if (node instanceof Geometry g) {
            return switch (key) {
                case "lat" -> g.lat();
                case "lng" -> g.lng();
                default -> null;
            };
        }
        if (node instanceof Bounds b) {
            return switch (key) {
                case "northeast" -> b.northeast();
                case "southwest" -> b.southwest();
                default -> null;
            };
        }
        return null;
    }
}
