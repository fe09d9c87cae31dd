package com.ivamare.connect.mapping;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a named mapping function for {@link MappingSource.MethodSource}.
 *
 * <p>Methods annotated with @ConnectMethod are discovered and registered by the
 * {@link MethodRegistry} when the bean is created.
 *
 * <p>Methods must have the signature:
 * <pre>
 * Object methodName(Document doc)
 * </pre>
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class CustomerMappings {
 *
 *     {@literal @}ConnectMethod("customer.fullName")
 *     public String fullName(Document doc) {
 *         return doc.get("first_name") + " " + doc.get("last_name");
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ConnectMethod {

    /**
     * The name mappings refer to this method by.
     *
     * @return method name (e.g., "customer.fullName")
     */
    String value();
}
