package io.github.flameyossnowy.sift.api.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes how a filter field constrains a query.
 * <p>
 * The value is a comma-separated list of {@code key=value} pairs. A leading bare token is
 * read as the operator shorthand:
 * <pre>{@code
 * public record ArticleFilter(
 *     @Search("contains,column=title|description") String keyword,
 *     @Search("between,params=type:date delimiter::") String publishedAt,
 *     @Search("in,params=type:int") String statuses,
 *     @Search("-") String internalNote
 * ) {}
 * }</pre>
 *
 * <ul>
 *   <li>{@code column} - target column, or several separated by {@code |} (pattern operators only)</li>
 *   <li>{@code operator} - explicit operator, wins over the shorthand</li>
 *   <li>{@code default} - fallback operator when neither {@code operator} nor a shorthand is given</li>
 *   <li>{@code alias} - table alias overriding the caller's default alias</li>
 *   <li>{@code params} - space-separated {@code key:value} hints ({@code delimiter}, {@code type})</li>
 * </ul>
 * The reserved values {@code "-"} (ignore the field) and {@code "dive"} (recurse into a nested
 * filter) are recognized as the whole value. Fields without this annotation compare with
 * {@code eq} against the snake_case form of the field name.
 * <p>
 * On a type, only {@code "-"} has a meaning: the fields of that class are not inherited by
 * subclass filters.
 *
 * @author FlameyosFlow
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.TYPE})
public @interface Search {
    String IGNORE = "-";

    String DIVE = "dive";

    String value() default "";
}
