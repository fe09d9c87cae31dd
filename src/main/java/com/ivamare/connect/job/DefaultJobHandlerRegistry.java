package com.ivamare.connect.job;

import com.ivamare.connect.exception.JobNotFoundException;
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
 * Default implementation of JobHandlerRegistry.
 *
 * <p>Implements BeanPostProcessor to discover @ConnectJob methods on Spring beans.
 */
public class DefaultJobHandlerRegistry implements JobHandlerRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultJobHandlerRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    @Override
    public void register(String jobName, JobHandler handler) {
        if (handlers.putIfAbsent(jobName, handler) != null) {
            throw new ValidationException("jobName", "job handler already registered: " + jobName);
        }
        log.debug("Registered job handler {}", jobName);
    }

    @Override
    public Optional<JobHandler> get(String jobName) {
        return Optional.ofNullable(handlers.get(jobName));
    }

    @Override
    public JobHandler getOrThrow(String jobName) {
        return get(jobName).orElseThrow(() -> new JobNotFoundException(jobName));
    }

    @Override
    public boolean hasHandler(String jobName) {
        return handlers.containsKey(jobName);
    }

    @Override
    public List<String> registeredNames() {
        return List.copyOf(handlers.keySet());
    }

    @Override
    public List<String> registerBean(Object bean) {
        List<String> registered = new ArrayList<>();

        for (Method method : bean.getClass().getMethods()) {
            ConnectJob annotation = method.getAnnotation(ConnectJob.class);
            if (annotation == null) {
                continue;
            }

            validateJobMethod(method);

            String jobName = annotation.value();
            register(jobName, args -> invoke(bean, method, args));
            registered.add(jobName);

            log.info("Discovered job {}.{}() as {}",
                bean.getClass().getSimpleName(), method.getName(), jobName);
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @ConnectJob methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasJobs = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(ConnectJob.class));

        if (hasJobs) {
            registerBean(bean);
        }

        return bean;
    }

    private static void invoke(Object bean, Method method, Map<String, Object> args) throws Exception {
        try {
            method.invoke(bean, args);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void validateJobMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 1 || !params[0].equals(Map.class)) {
            throw new IllegalArgumentException(
                "Job method " + method.getName() + " must have signature: " +
                "void methodName(Map<String, Object> args)"
            );
        }
    }
}
