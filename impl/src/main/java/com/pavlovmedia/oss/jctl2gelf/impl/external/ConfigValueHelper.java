package com.pavlovmedia.oss.jctl2gelf.impl.external;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Note: This class started life as the iron property helper from a different
 * pavlov project
 * 
 * Typed, null-safe access to the untyped map a configuration document is
 * read into. Missing keys and explicit nulls both come back as an empty
 * Optional.
 * 
 * @author Shawn Dempsay {@literal <sdempsay@pavlovmedia.com>}
 *
 */
public class ConfigValueHelper {
    private final Map<String,Object> properties;
    
    public ConfigValueHelper(final Map<String,Object> properties) {
        this.properties = null == properties ? Collections.emptyMap() : properties;
    }
    
    public boolean contains(final String propertyName) {
        return null != properties.get(propertyName);
    }
    
    /**
     * This will return a type-safe conversion. If the property does not
     * exist, or is of the wrong type, it will return an empty Optional
     */
    public <T extends Object> Optional<T> getSafe(final String propertyName, final Class<T> clazz) {
        return safeCast(properties.get(propertyName), clazz);
    }
    
    /**
     * Returns a helper over a nested table, like <code>[global]</code> in TOML.
     * If the table is missing an empty helper is returned.
     */
    @SuppressWarnings("unchecked")
    public ConfigValueHelper getTable(final String propertyName) {
        return new ConfigValueHelper(getSafe(propertyName, Map.class).orElse(Collections.emptyMap()));
    }
    
    /**
     * This will get a string from the property. If the object is not a
     * string, it will return the output of toString.
     */
    public Optional<String> getString(final String propertyName) {
        return Optional.ofNullable(properties.get(propertyName)).map(o -> getString(o));
    }
    
    /**
     * This will get an Integer by property name. If the type is not a Number
     * it will use the string value of the object and parse it.
     * 
     * @throws NumberFormatException if the value is present but not a number
     */
    public Optional<Integer> getInteger(final String propertyName) throws NumberFormatException {
        return Optional.ofNullable(properties.get(propertyName)).map(o -> getInteger(o));
    }
    
    /**
     * Reads a string property and maps it through a lookup, typically an
     * enum's <code>fromName</code>.
     * 
     * @throws IllegalArgumentException if the value is present and the lookup rejects it
     */
    public <T> Optional<T> getNamed(final String propertyName, final Function<String,Optional<T>> lookup) {
        Optional<String> raw = getString(propertyName);
        if (!raw.isPresent()) {
            return Optional.empty();
        }
        return Optional.of(lookup.apply(raw.get())
                .orElseThrow(() -> new IllegalArgumentException(
                        String.format("%s: unknown value '%s'", propertyName, raw.get()))));
    }
    
    /**
     * Does a safeCast to Number, and if that fails parses toString().
     * Note: This can throw a parse exception.
     */
    public static Integer getInteger(final Object o) throws NumberFormatException {
        Optional<Number> number = safeCast(o, Number.class);
        if (number.isPresent()) {
            long value = number.get().longValue();
            if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
                throw new NumberFormatException("Out of range: " + value);
            }
            return (int) value;
        }
        return Integer.decode(o.toString().trim());
    }
    
    /**
     * Does a safeCast to String, and if that fails returns toString()
     */
    public static String getString(final Object o) {
        return safeCast(o, String.class).orElse(o.toString());
    }
    
    /**
     * This will return a type-safe conversion. If the type is not correct
     * it returns an empty Optional.
     */
    @SuppressWarnings("unchecked")
    public static <T extends Object> Optional<T> safeCast(final Object o, final Class<T> clazz) {
        if (clazz.isInstance(o)) {
            return Optional.of((T) o);
        }
        return Optional.empty();
    }
}
