/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowrun.hooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry and dispatcher of {@link ExternalHook}s.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class ExternalHooks {

    public static final String WORKFLOW_PRE_EXECUTE = "workflow.preExecute";
    public static final String WORKFLOW_POST_EXECUTE = "workflow.postExecute";

    private static final Logger logger = LoggerFactory.getLogger(ExternalHooks.class);

    private final List<String> hookClassNames;
    private final ClassLoader classLoader;
    private final List<ExternalHook> hooks = new CopyOnWriteArrayList<>();

    public ExternalHooks() {
        this(List.of());
    }

    public ExternalHooks(List<String> hookClassNames) {
        this(hookClassNames, ExternalHooks.class.getClassLoader());
    }

    public ExternalHooks(List<String> hookClassNames, ClassLoader classLoader) {
        this.hookClassNames = List.copyOf(Objects.requireNonNull(hookClassNames, "Hook class names cannot be null"));
        this.classLoader = Objects.requireNonNull(classLoader, "Class loader cannot be null");
    }

    /**
     * Instantiates the configured hook classes.
     *
     * @throws ReflectiveOperationException if a class cannot be loaded or instantiated
     * @throws IllegalArgumentException if a class does not implement {@link ExternalHook}
     */
    public void init() throws ReflectiveOperationException {
        List<ExternalHook> loaded = new ArrayList<>();
        for (String className : hookClassNames) {
            Class<?> hookClass = Class.forName(className, true, classLoader);
            if (!ExternalHook.class.isAssignableFrom(hookClass)) {
                throw new IllegalArgumentException("Class " + className + " does not implement "
                        + ExternalHook.class.getName());
            }
            loaded.add((ExternalHook) hookClass.getDeclaredConstructor().newInstance());
            logger.debug("Loaded external hook {}", className);
        }
        hooks.addAll(loaded);
        if (!loaded.isEmpty()) {
            logger.info("Loaded {} external hook(s)", loaded.size());
        }
    }

    public void register(ExternalHook hook) {
        hooks.add(Objects.requireNonNull(hook, "Hook cannot be null"));
    }

    /**
     * Runs every hook registered for {@code hookName}, in registration order. The first failure
     * stops the chain and is propagated.
     */
    public void run(String hookName, Object... args) throws Exception {
        for (ExternalHook hook : hooks) {
            if (hook.getHookNames().contains(hookName)) {
                logger.debug("Running hook {} on {}", hookName, hook.getClass().getName());
                hook.run(hookName, args);
            }
        }
    }

    public int size() {
        return hooks.size();
    }
}
