package io.github.flameyossnowy.sift.api.options;

/**
 * One node of a recorded filter tree.
 */
public sealed interface FilterOption permits SelectOption, GroupOption {
    Conjunction conjunction();
}
