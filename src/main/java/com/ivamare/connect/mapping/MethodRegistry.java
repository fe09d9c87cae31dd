package com.ivamare.connect.mapping;

import java.util.List;
import java.util.Optional;

/**
 * Registry of named mapping functions.
 */
public interface MethodRegistry {

    /**
     * Register a function under a name.
     *
     * @throws com.ivamare.connect.exception.ValidationException if the name is already taken
     */
    void register(String name, MappingMethod method);

    Optional<MappingMethod> get(String name);

    /**
     * @throws com.ivamare.connect.exception.ValidationException if not registered
     */
    MappingMethod getOrThrow(String name);

    List<String> registeredNames();

    /**
     * Scan a bean for @ConnectMethod annotated methods and register them.
     *
     * @param bean The bean to scan
     * @return names registered
     */
    List<String> registerBean(Object bean);
}
