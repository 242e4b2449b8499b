package com.hookintel.hook.service.hook;

import com.hookintel.hook.model.HookCategory;

import java.util.function.Predicate;

/**
 * One classification rule: a predicate over the lower-cased hook and the category it assigns.
 */
public record HookRule(HookCategory category, Predicate<String> matcher) {

    public boolean matches(String lowerCasedHook) {
        return matcher.test(lowerCasedHook);
    }
}
