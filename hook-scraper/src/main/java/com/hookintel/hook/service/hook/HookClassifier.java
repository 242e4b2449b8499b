package com.hookintel.hook.service.hook;

import com.hookintel.hook.model.HookCategory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Assigns exactly one taxonomy category to a hook. The first matching rule wins;
 * a hook no rule matches, including the empty hook, is a STATEMENT.
 */
@Component
public class HookClassifier {

    private final List<HookRule> rules;

    @Autowired
    public HookClassifier() {
        this(HookRules.defaults());
    }

    public HookClassifier(List<HookRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public HookCategory classify(String hook) {
        if (hook == null || hook.isBlank()) {
            return HookCategory.STATEMENT;
        }
        String lower = hook.toLowerCase(Locale.ROOT).replace('’', '\'');
        for (HookRule rule : rules) {
            if (rule.matches(lower)) {
                return rule.category();
            }
        }
        return HookCategory.STATEMENT;
    }

    public List<HookRule> getRules() {
        return rules;
    }
}
