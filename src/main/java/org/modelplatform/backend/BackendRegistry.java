package org.modelplatform.backend;

import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.modelplatform.api.backend.IBackend;
import org.modelplatform.api.exceptions.ModelPlatformException;
import org.modelplatform.backend.h2.H2Backend;
import org.modelplatform.backend.memory.InMemoryBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Registry of backend implementations by name.
 * <p>
 * Implementations must provide a public constructor taking the engine options as {@link Config}.
 * The names {@code memory} and {@code h2} are registered by default; a fully qualified class
 * name is accepted as well and loaded via reflection.
 */
public final class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private static final Map<String, Class<? extends IBackend>> BACKENDS = new ConcurrentHashMap<>();

    static {
        BACKENDS.put("memory", InMemoryBackend.class);
        BACKENDS.put("h2", H2Backend.class);
    }

    private BackendRegistry() {
    }

    /**
     * Registers or replaces a backend class under {@code name}.
     */
    public static void register(String name, Class<? extends IBackend> backendClass) {
        Class<? extends IBackend> previous = BACKENDS.put(name, backendClass);
        if (previous != null && previous != backendClass) {
            log.debug("Backend '{}' re-registered: {} replaces {}", name, backendClass.getName(), previous.getName());
        }
    }

    public static Set<String> names() {
        return new TreeSet<>(BACKENDS.keySet());
    }

    /**
     * Instantiates a backend.
     *
     * @param name    registered name or fully qualified class name
     * @param options engine options passed to the constructor
     * @return the opened backend
     * @throws IllegalArgumentException if the backend cannot be resolved or instantiated
     * @throws ModelPlatformException   raised by the backend constructor itself, e.g. for unknown options
     */
    public static IBackend create(String name, Config options) {
        Class<?> backendClass = BACKENDS.get(name);
        if (backendClass == null) {
            try {
                backendClass = Class.forName(name);
            } catch (ClassNotFoundException e) {
                throw new IllegalArgumentException("Unknown backend '" + name + "'. Registered backends: " + names()
                        + "; alternatively give a fully qualified class name on the classpath.", e);
            }
        }
        if (!IBackend.class.isAssignableFrom(backendClass)) {
            throw new IllegalArgumentException("Backend class must implement IBackend: " + backendClass.getName());
        }
        try {
            IBackend backend = (IBackend) backendClass.getDeclaredConstructor(Config.class).newInstance(options);
            log.debug("Created backend '{}' ({})", name, backendClass.getSimpleName());
            return backend;
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("Backend must have public constructor(Config): "
                    + backendClass.getName(), e);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof ModelPlatformException platformException) {
                throw platformException;
            }
            throw new IllegalArgumentException("Failed to instantiate backend: " + backendClass.getName()
                    + ". Error: " + e.getCause().getMessage(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate backend: " + backendClass.getName()
                    + ". Error: " + e.getMessage(), e);
        }
    }
}
