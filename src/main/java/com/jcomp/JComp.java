package com.jcomp;

import com.jcomp.comprehension.Comprehension;
import com.jcomp.comprehension.ComprehensionTranslator;
import com.jcomp.comprehension.OutputKind;
import com.jcomp.host.ScriptLanguage;
import com.jcomp.json.JsonBindingsReader;
import com.jcomp.output.ValueFormatter;
import com.jcomp.token.Fragment;
import com.jcomp.token.Lexer;
import com.jcomp.value.Scope;
import com.jcomp.value.Value;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "jcomp", mixinStandardHelpOptions = true, version = "1.0",
         description = "Evaluate a list, map or statement comprehension")
public class JComp implements Callable<Integer> {
    @Parameters(index = "0", description = "The comprehension, e.g. \"x * x for x in 1..=10 if x % 2 == 0\"")
    private String comprehension;

    @Parameters(index = "1", arity = "0..1", description = "JSON object of initial variables")
    private File varsFile;

    @Option(names = {"-D", "--define"}, description = "Initial variable as name=expression, e.g. -D n=0")
    private Map<String, String> definitions = new LinkedHashMap<>();

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort map keys in output")
    private boolean sortKeys = false;

    private final PrintStream out;
    private final PrintStream err;

    public JComp() {
        this(System.out, System.err);
    }

    JComp(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JComp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            // Translate first so a malformed comprehension fails before any input is read
            Comprehension translated = new ComprehensionTranslator().translate(comprehension);

            Scope scope = new Scope(out);
            if (varsFile != null) {
                try (InputStream input = new FileInputStream(varsFile)) {
                    new JsonBindingsReader().read(input, scope);
                }
            }
            define(scope);

            Value result = translated.evaluate(scope);

            ValueFormatter formatter = new ValueFormatter(!compactOutput, sortKeys);
            if (translated.outputKind() == OutputKind.STATEMENT) {
                MutableMap<Value, Value> variables = Maps.mutable.empty();
                scope.variables().forEachKeyValue((name, value) -> variables.put(Value.of(name), value));
                out.println(formatter.format(new Value.MapValue(variables)));
            } else {
                out.println(formatter.format(result));
            }

            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void define(Scope scope) {
        Lexer lexer = new Lexer();
        ScriptLanguage language = new ScriptLanguage();
        definitions.forEach((name, source) -> {
            Fragment fragment = Fragment.of(lexer.tokenize(source).consume());
            scope.define(name, language.expression(fragment).evaluate(scope));
        });
    }
}
