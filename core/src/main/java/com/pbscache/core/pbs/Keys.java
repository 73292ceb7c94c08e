package com.pbscache.core.pbs;

/**
 * Document store keyspace.
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Consolidated scheduler document of one site: {@code pbs_{site}}.
     * <p>
     * <b>Type:</b> String (serialized JSON document), replaced as a whole on every pass.
     * </p>
     *
     * @param site site (location) name
     * @return store key
     */
    public static String site(String site) {
        return "pbs_" + site;
    }

    /**
     * Application registry: {@code app}, a mapping of application name to descriptor.
     *
     * @return store key
     */
    public static String apps() {
        return "app";
    }
}
