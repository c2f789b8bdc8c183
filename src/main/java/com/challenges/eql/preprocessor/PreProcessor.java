package com.challenges.eql.preprocessor;

import com.challenges.eql.ast.BaseMacro;
import com.challenges.eql.ast.Constant;
import com.challenges.eql.ast.CustomMacro;
import com.challenges.eql.ast.Definition;
import com.challenges.eql.ast.DuplicateDefinitionException;
import com.challenges.eql.ast.EqlNode;
import com.challenges.eql.ast.Field;
import com.challenges.eql.ast.FunctionCall;
import com.challenges.eql.ast.Macro;
import com.challenges.eql.optimizer.Optimizer;
import com.challenges.eql.walk.RecursiveWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores constant and macro definitions and expands them wherever they are referenced.
 * <p>
 * Registration mutates the instance and is not thread safe. Once built up, {@link #expand(EqlNode)} may be shared.
 */
public class PreProcessor {

    private static final Logger log = LoggerFactory.getLogger(PreProcessor.class);

    private final Optimizer optimizer;
    private final Map<String, Constant> constants = new LinkedHashMap<>();
    private final Map<String, BaseMacro> macros = new LinkedHashMap<>();

    public PreProcessor(Optimizer optimizer) {
        this.optimizer = optimizer;
    }

    public PreProcessor(Optimizer optimizer, Iterable<? extends Definition> definitions) {
        this(optimizer);
        addDefinitions(definitions);
    }

    public void addDefinitions(Iterable<? extends Definition> definitions) {
        for (Definition definition : definitions) {
            addDefinition(definition);
        }
    }

    /**
     * Add a named definition. Macros are expanded against what is already defined, so they may call earlier
     * macros, and a later macro replaces an earlier one of the same name.
     *
     * @throws DuplicateDefinitionException if a constant with the same name is already defined
     */
    public void addDefinition(Definition definition) {
        String name = definition.name();
        if (definition instanceof Macro macro) {
            macros.put(name, (Macro) expand(macro));
            log.debug("Defined macro {}", name);
        } else if (definition instanceof CustomMacro custom) {
            macros.put(name, custom);
            log.debug("Defined custom macro {}", name);
        } else if (definition instanceof Constant constant) {
            if (constants.containsKey(name)) {
                throw new DuplicateDefinitionException(name, "Constant " + name + " already defined");
            }
            constants.put(name, constant);
            log.debug("Defined constant {}", name);
        }
    }

    /**
     * Replace references to constants with their values and calls to macros with their expansions.
     */
    public EqlNode expand(EqlNode root) {
        if (constants.isEmpty() && macros.isEmpty()) {
            return root;
        }

        RecursiveWalker walker = new RecursiveWalker()
                .register(Field.class, field -> {
                    Constant constant = constants.get(field.base());
                    return constant != null && field.path().isEmpty() ? constant.value() : field;
                })
                .register(FunctionCall.class, call -> {
                    BaseMacro macro = macros.get(call.name());
                    if (macro == null) {
                        return call;
                    }
                    log.debug("Expanding macro {} with {} arguments", call.name(), call.arguments().size());
                    return macro.expand(call.arguments().castToList(), optimizer);
                });
        return walker.walk(root);
    }

    /**
     * Shallow copy holding the same definitions, which can then be extended independently.
     */
    public PreProcessor copy() {
        PreProcessor preprocessor = new PreProcessor(optimizer);
        preprocessor.constants.putAll(constants);
        preprocessor.macros.putAll(macros);
        return preprocessor;
    }

    public Map<String, Constant> constants() {
        return Collections.unmodifiableMap(constants);
    }

    public Map<String, BaseMacro> macros() {
        return Collections.unmodifiableMap(macros);
    }

    public Optimizer optimizer() {
        return optimizer;
    }
}
