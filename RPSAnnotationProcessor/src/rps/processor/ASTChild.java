package rps.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Marks an accessor of an {@link ASTNode} whose result is walked by {@code visitChildren}. */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface ASTChild {}
