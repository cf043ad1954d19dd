package rps.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a node of a visitable tree.
 *
 * <p>The annotated class must implement {@code <Outer>_<Name>_ASTNode}, which is generated in the
 * same package together with the {@code ASTVisitor} family of types.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ASTNode {}
