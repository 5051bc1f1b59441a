package com.stylgebra.style;

import com.stylgebra.error.InvalidStyleException;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Map;

/**
 * The rendering options in effect for one render call. Most node kinds read an
 * {@link Options} map; variables read a {@link Substitution}.
 */
public sealed interface Style {
    String SUBST = "subst";

    Options NONE = new Options(Maps.immutable.empty());

    record Options(ImmutableMap<String, Object> values) implements Style {
        public boolean has(String key) {
            return values.containsKey(key);
        }

        public Object get(String key) {
            return values.get(key);
        }

        public String getString(String key, String defaultValue) {
            Object v = values.get(key);
            return v == null ? defaultValue : v.toString();
        }

        public boolean getBoolean(String key, boolean defaultValue) {
            Object v = values.get(key);
            if (v == null) {
                return defaultValue;
            }
            if (v instanceof Boolean b) {
                return b;
            }
            if (v instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
                return Boolean.parseBoolean(s);
            }
            throw new InvalidStyleException(key, v);
        }

        public int getInt(String key, int defaultValue) {
            Object v = values.get(key);
            if (v == null) {
                return defaultValue;
            }
            if (v instanceof Number n) {
                return n.intValue();
            }
            try {
                return Integer.parseInt(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidStyleException(key, v);
            }
        }

        public Options with(String key, Object value) {
            return new Options(values.newWithKeyValue(key, value));
        }

        public Options without(String key) {
            return new Options(values.newWithoutKey(key));
        }

        /**
         * A new map holding these options overridden key by key by {@code other}.
         */
        public Options merge(Options other) {
            if (other.values.isEmpty()) {
                return this;
            }
            MutableMap<String, Object> merged = Maps.mutable.ofMap(values.castToMap());
            merged.putAll(other.values.castToMap());
            return new Options(merged.toImmutable());
        }
    }

    /**
     * Asks a variable to stand for {@code value}. The extra options are passed on as the
     * modifier for rendering the substituted value.
     */
    record Substitution(Object value, Options extra) implements Style {
        public Substitution {
            if (extra == null) {
                extra = NONE;
            }
        }
    }

    static Options of() {
        return NONE;
    }

    static Options of(String k1, Object v1) {
        return new Options(Maps.immutable.of(k1, v1));
    }

    static Options of(String k1, Object v1, String k2, Object v2) {
        return new Options(Maps.immutable.of(k1, v1, k2, v2));
    }

    static Options of(String k1, Object v1, String k2, Object v2, String k3, Object v3) {
        return new Options(Maps.immutable.of(k1, v1, k2, v2, k3, v3));
    }

    static Options of(String k1, Object v1, String k2, Object v2, String k3, Object v3, String k4, Object v4) {
        return new Options(Maps.immutable.of(k1, v1, k2, v2, k3, v3, k4, v4));
    }

    /**
     * Builds a style from a map. A map carrying a {@value #SUBST} key becomes a
     * {@link Substitution} whose extra options are the remaining keys.
     */
    static Style options(Map<String, ?> map) {
        MutableMap<String, Object> copy = Maps.mutable.empty();
        copy.putAll(map);
        ImmutableMap<String, Object> values = copy.toImmutable();
        if (values.containsKey(SUBST)) {
            return new Substitution(values.get(SUBST), new Options(values.newWithoutKey(SUBST)));
        }
        return new Options(values);
    }

    static Substitution subst(Object value) {
        return new Substitution(value, NONE);
    }

    static Substitution subst(Object value, Options extra) {
        return new Substitution(value, extra);
    }
}
