package com.awsmcp.mcp.api;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.provider.ErrorNormalizer;

/**
 * Dispatch table from tool name to descriptor and handler.
 * Populated once at startup, read-only afterwards, so lookups from concurrent requests need no locking.
 */
public class ToolRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRegistry.class);

    private record Registration(ToolDef def, ToolHandler handler) {}

    private final Map<String, Registration> tools = new LinkedHashMap<>();

    /**
     * Register a tool.
     *
     * @throws DuplicateToolException if a tool with the same name is already registered
     */
    public void register(ToolDef def, ToolHandler handler) {
        if (tools.containsKey(def.getName())) {
            throw new DuplicateToolException(def.getName());
        }
        tools.put(def.getName(), new Registration(def, handler));
        LOG.debug("Registered tool {}", def.getName());
    }

    /**
     * Register every @McpTool method of a service object, sorted by method name.
     *
     * @return number of tools registered
     */
    public int registerAnnotated(Object service) {
        List<Method> methods = new ArrayList<>(Arrays.asList(service.getClass().getDeclaredMethods()));
        methods.sort(Comparator.comparing(Method::getName));

        int count = 0;
        for (Method method : methods) {
            McpTool annotation = method.getAnnotation(McpTool.class);
            if (annotation == null) continue;

            ToolDef def = ToolDef.fromMethod(method, annotation);
            register(def, new MethodToolHandler(service, method, def));
            count++;
        }
        LOG.info("Registered {} tools from {}", count, service.getClass().getSimpleName());
        return count;
    }

    /**
     * Validate the arguments and run the named tool.
     * Argument failures come back as a validation result without reaching the handler.
     *
     * @throws UnknownToolException if no tool with that name is registered
     */
    public ToolResult invoke(String name, Map<String, Object> arguments) {
        Registration registration = tools.get(name);
        if (registration == null) {
            throw new UnknownToolException(name);
        }

        ToolArguments bound;
        try {
            bound = registration.def().bind(arguments);
        } catch (ArgumentException e) {
            return ToolResult.validationError(e.getMessage());
        }

        try {
            ToolResult result = registration.handler().handle(bound);
            return result != null ? result
                : ErrorNormalizer.classify(new IllegalStateException("Tool " + name + " returned no result"));
        } catch (RuntimeException e) {
            return ErrorNormalizer.classify(e);
        }
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    /** Tool descriptors in registration order. */
    public List<ToolDef> list() {
        return tools.values().stream().map(Registration::def).toList();
    }

    public int size() {
        return tools.size();
    }
}
