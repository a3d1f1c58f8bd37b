package io.github.drompincen.simgate.runtime.tools;

import io.github.drompincen.simgate.protocol.api.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the tools exposed to callers. Tools are discovered through {@link ServiceLoader}; every
 * public single-argument setter of a tool is satisfied from the Spring context when a matching
 * bean exists.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public ToolRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void loadTools() {
        for (Tool tool : ServiceLoader.load(Tool.class)) {
            injectDependencies(tool);
            register(tool);
        }
        log.info("Loaded {} simulation tools via SPI", tools.size());
    }

    public void register(Tool tool) {
        Tool previous = tools.putIfAbsent(tool.name(), tool);
        if (previous != null && previous != tool) {
            throw new IllegalStateException("Duplicate tool name '" + tool.name() + "': "
                    + previous.getClass().getName() + " and " + tool.getClass().getName());
        }
        log.debug("Registered tool: {}", tool.name());
    }

    public Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public List<String> names() {
        return tools.keySet().stream().sorted().toList();
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream()
                .sorted(Comparator.comparing(Tool::name))
                .map(ToolRegistry::describe)
                .toList();
    }

    public static ToolDescriptor describe(Tool t) {
        return new ToolDescriptor(t.name(), t.description(), t.inputSchema(), t.outputSchema(), t.riskProfiles());
    }

    private void injectDependencies(Tool tool) {
        for (Method method : tool.getClass().getMethods()) {
            if (!method.getName().startsWith("set") || method.getParameterCount() != 1) continue;
            Class<?> paramType = method.getParameterTypes()[0];
            Object bean;
            try {
                bean = applicationContext.getBean(paramType);
            } catch (NoSuchBeanDefinitionException e) {
                log.trace("No bean of type {} for {}.{}", paramType.getSimpleName(),
                        tool.getClass().getSimpleName(), method.getName());
                continue;
            }
            try {
                method.invoke(tool, bean);
                log.debug("Injected {} into {}.{}", paramType.getSimpleName(),
                        tool.getClass().getSimpleName(), method.getName());
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new IllegalStateException("Failed to inject " + paramType.getSimpleName()
                        + " into " + tool.getClass().getSimpleName(), e);
            }
        }
    }
}
