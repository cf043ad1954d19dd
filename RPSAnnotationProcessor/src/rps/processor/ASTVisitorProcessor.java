package rps.processor;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;
import javax.tools.JavaFileObject;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing for {@link ASTNode} classes.
 *
 * <p>For every annotated class an {@code X_ASTNode} interface is written with default {@code
 * accept} and {@code visitChildren} methods; the latter walks every {@link ASTChild} accessor
 * through {@code ASTNodeUtils}. Once all rounds are done, {@code ASTVisitor}, {@code
 * DefaultASTVisitor} and {@code VoidDefaultASTVisitor} are written with one {@code visit} method
 * per node. All nodes of one compilation must live in the same package, which must also contain
 * the hand-written {@code ASTNodeInterface} and {@code ASTNodeUtils}.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  private final Set<String> allAstNodes = new TreeSet<>();
  private String packageName = null;

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        // Test sources and other compilations without nodes must not shadow the real visitors.
        if (!allAstNodes.isEmpty()) generateASTVisitorFiles();
      } else if (!annotations.isEmpty()) {
        processImpl(roundEnv);
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  @FunctionalInterface
  private static interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(String name, String format, TypeRenderer typeRenderer) throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(packageName + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              packageName,
              allAstNodes
                  .stream()
                  .map(typeRenderer::renderType)
                  .collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateASTVisitorFiles() throws IOException {
    writeFile(
        "ASTVisitor",
        "package %s;\n\npublic interface ASTVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeFile(
        "DefaultASTVisitor",
        "package %s;\n\n"
            + "public abstract class DefaultASTVisitor<V> implements ASTVisitor<V> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return node.visitChildren(this, value);\n"
                    + "  }",
                typeName));
    writeFile(
        "VoidDefaultASTVisitor",
        "package %s;\n\n"
            + "public abstract class VoidDefaultASTVisitor extends DefaultASTVisitor<Void> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%s node) {\n"
                    + "    node.visitChildren(this, null);\n"
                    + "  }",
                typeName, typeName));
  }

  private static String getASTNodeClassName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return elems.stream().collect(Collectors.joining("_"));
  }

  private static final TypeVariableName V = TypeVariableName.get("V");

  private void writeASTNodeFile(TypeElement element) throws IOException {
    String getInterfaceName = getASTNodeClassName(element);
    if (!element
        .getInterfaces()
        .stream()
        .anyMatch(i -> TypeName.get(i).toString().endsWith(getInterfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + getInterfaceName, element);
      return;
    }

    ClassName nodeInterfaceName = ClassName.get(packageName, "ASTNodeInterface");
    ClassName visitorName = ClassName.get(packageName, "ASTVisitor");
    ClassName nodeUtilsName = ClassName.get(packageName, "ASTNodeUtils");

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(getInterfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(nodeInterfaceName);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(visitorName, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build())
            .addStatement(
                "return visitor.visit(($L) this, value)", element.getQualifiedName().toString())
            .build());

    MethodSpec.Builder visitChildrenMethodBuilder =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(visitorName, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build());
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(ASTChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(method.getSimpleName().toString())
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());

      visitChildrenMethodBuilder.addStatement(
          "value = $T.accept($L(), visitor, value)",
          nodeUtilsName,
          method.getSimpleName().toString());
    }
    typeSpecBuilder.addMethod(visitChildrenMethodBuilder.addStatement("return value").build());

    JavaFile javaFile = JavaFile.builder(packageName, typeSpecBuilder.build()).build();
    JavaFileObject file =
        processingEnv.getFiler().createSourceFile(packageName + "." + getInterfaceName);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private boolean claimPackage(TypeElement element) {
    String elementPackage =
        processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();
    if (packageName == null) {
      packageName = elementPackage;
    } else if (!packageName.equals(elementPackage)) {
      processingEnv
          .getMessager()
          .printMessage(
              Kind.ERROR,
              String.format(
                  "@ASTNode classes must share one package; expected %s", packageName),
              element);
      return false;
    }
    return true;
  }

  private void processImpl(RoundEnvironment roundEnv) throws IOException {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      if (!claimPackage(typeElement)) continue;

      try {
        writeASTNodeFile(typeElement);
      } catch (Exception ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }

      String extra = "";
      if (typeElement.getTypeParameters().size() > 0) {
        extra =
            typeElement
                .getTypeParameters()
                .stream()
                .map(p -> "?")
                .collect(Collectors.joining(", ", "<", ">"));
      }
      allAstNodes.add(typeElement.getQualifiedName().toString() + extra);
    }
  }
}
