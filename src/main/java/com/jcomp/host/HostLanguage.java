package com.jcomp.host;

import com.jcomp.token.Fragment;

/**
 * The evaluation facility that gives meaning to the opaque fragments of a comprehension.
 * All three operations run at translation time and throw {@link HostSyntaxException} when a
 * fragment is not valid in the language.
 */
public interface HostLanguage {

    HostExpression expression(Fragment fragment);

    HostStatement statement(Fragment fragment);

    HostPattern pattern(Fragment fragment);
}
