package com.ivamare.connect.mapping;

import com.ivamare.connect.document.Document;
import com.ivamare.connect.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of MethodRegistry.
 *
 * <p>Implements BeanPostProcessor to discover and register mapping functions
 * from Spring beans with @ConnectMethod methods.
 */
public class DefaultMethodRegistry implements MethodRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultMethodRegistry.class);

    private final Map<String, MappingMethod> methods = new ConcurrentHashMap<>();

    @Override
    public void register(String name, MappingMethod method) {
        if (methods.putIfAbsent(name, method) != null) {
            throw new ValidationException("methodName", "mapping method already registered: " + name);
        }
        log.debug("Registered mapping method {}", name);
    }

    @Override
    public Optional<MappingMethod> get(String name) {
        return Optional.ofNullable(methods.get(name));
    }

    @Override
    public MappingMethod getOrThrow(String name) {
        return get(name)
            .orElseThrow(() -> new ValidationException("methodName", "no mapping method registered: " + name));
    }

    @Override
    public List<String> registeredNames() {
        return List.copyOf(methods.keySet());
    }

    @Override
    public List<String> registerBean(Object bean) {
        List<String> registered = new ArrayList<>();

        for (Method method : bean.getClass().getMethods()) {
            ConnectMethod annotation = method.getAnnotation(ConnectMethod.class);
            if (annotation == null) {
                continue;
            }

            validateMethod(method);

            String name = annotation.value();
            register(name, doc -> invoke(bean, method, doc));
            registered.add(name);

            log.info("Discovered mapping method {}.{}() as {}",
                bean.getClass().getSimpleName(), method.getName(), name);
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @ConnectMethod methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasMethods = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(ConnectMethod.class));

        if (hasMethods) {
            registerBean(bean);
        }

        return bean;
    }

    private static Object invoke(Object bean, Method method, Document doc) throws Exception {
        try {
            return method.invoke(bean, doc);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void validateMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 1 || !params[0].equals(Document.class)) {
            throw new IllegalArgumentException(
                "Mapping method " + method.getName() + " must have signature: " +
                "Object methodName(Document doc)"
            );
        }
    }
}
