package com.jcomp.comprehension;

import com.jcomp.ComprehensionSyntaxException;
import com.jcomp.ErrorKind;
import com.jcomp.token.Fragment;
import com.jcomp.token.Token;
import com.jcomp.token.TokenKind;
import org.eclipse.collections.api.list.ImmutableList;

public class BodyClassifier {

    public BodyKind classify(NormalizedStream stream) {
        return classify(stream.body());
    }

    public BodyKind classify(ImmutableList<Token> body) {
        if (body.isEmpty()) {
            throw new ComprehensionSyntaxException(ErrorKind.EMPTY_BODY, "Missing comprehension body", -1);
        }

        // A map separator wins over a trailing ';', so "k: v;" is a mapping whose value is "v;"
        int separator = body.detectIndex(token -> token.kind() == TokenKind.MAP_SEPARATOR);
        if (separator >= 0) {
            Fragment key = Fragment.of(body.subList(0, separator));
            Fragment value = Fragment.of(body.subList(separator + 1, body.size()));
            if (key.isEmpty() || value.isEmpty()) {
                throw new ComprehensionSyntaxException(ErrorKind.EMPTY_BODY,
                    "Mapping body needs both a key and a value", body.get(separator).position());
            }
            return new BodyKind.Mapping(key, value);
        }

        Token last = body.getLast();
        if (last.isPunct(";")) {
            Fragment stmt = Fragment.of(body.subList(0, body.size() - 1));
            if (stmt.isEmpty()) {
                throw new ComprehensionSyntaxException(ErrorKind.EMPTY_BODY,
                    "Statement body is empty", last.position());
            }
            return new BodyKind.Statement(stmt);
        }

        return new BodyKind.Sequence(Fragment.of(body));
    }
}
