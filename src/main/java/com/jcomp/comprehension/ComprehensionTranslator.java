package com.jcomp.comprehension;

import com.jcomp.host.HostLanguage;
import com.jcomp.host.ScriptLanguage;
import com.jcomp.token.Lexer;
import com.jcomp.token.RawClauseStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: source text in, executable {@link Comprehension} out. Every syntax error is
 * raised here, before anything is evaluated.
 */
public class ComprehensionTranslator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComprehensionTranslator.class);

    private final Lexer lexer = new Lexer();
    private final Normalizer normalizer = new Normalizer();
    private final BodyClassifier classifier = new BodyClassifier();
    private final ClauseParser clauseParser = new ClauseParser();
    private final LoweringEngine loweringEngine;

    public ComprehensionTranslator() {
        this(new ScriptLanguage());
    }

    public ComprehensionTranslator(HostLanguage host) {
        this.loweringEngine = new LoweringEngine(host);
    }

    public Comprehension translate(String source) {
        return translate(lexer.tokenize(source));
    }

    public Comprehension translate(RawClauseStream raw) {
        NormalizedStream normalized = normalizer.normalize(raw);
        BodyKind body = classifier.classify(normalized);
        ClauseList clauses = clauseParser.parse(normalized);
        LOGGER.debug("Parsed '{}' as {} body with clauses {}", raw.source(), body.outputKind(), clauses);
        return loweringEngine.compile(raw.source(), body, clauses);
    }
}
