package rtc.processor;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates, for every {@link ASTNode} class, an {@code <Outer>_<Name>_ASTNode} interface whose
 * {@code accept} dispatches to the visitor and whose {@code visitChildren} walks the
 * {@link ASTChild} accessors in declaration order.
 *
 * <p>Once every round is done it also generates {@code ASTVisitor} with one {@code visit} per node
 * class, and the {@code DefaultASTVisitor} and {@code VoidDefaultASTVisitor} bases. A compilation
 * that declares no node class, such as the test sources, generates no visitors.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String PACKAGE = "rtc";

  private static final ClassName AST_NODE_INTERFACE = ClassName.get(PACKAGE, "ASTNodeInterface");
  private static final ClassName AST_NODE_UTILS = ClassName.get(PACKAGE, "ASTNodeUtils");
  private static final ClassName AST_VISITOR = ClassName.get(PACKAGE, "ASTVisitor");
  private static final ClassName DEFAULT_VISITOR = ClassName.get(PACKAGE, "DefaultASTVisitor");
  private static final ClassName VOID_DEFAULT_VISITOR =
      ClassName.get(PACKAGE, "VoidDefaultASTVisitor");
  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final ClassName VOID = ClassName.get(Void.class);

  // Sorted by canonical name so the generated visitors are stable across builds.
  private final Map<String, ClassName> nodeClasses = new TreeMap<>();

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        if (!nodeClasses.isEmpty()) writeVisitors();
      } else {
        for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
          TypeElement node = (TypeElement) element;
          if (checkNodeClass(node)) {
            nodeClasses.put(node.getQualifiedName().toString(), ClassName.get(node));
            write(nodeInterface(node));
          }
        }
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }
    return true;
  }

  static String interfaceName(ClassName nodeClass) {
    return Joiner.on('_').join(nodeClass.simpleNames()) + "_ASTNode";
  }

  private void error(String msg, Element element) {
    processingEnv.getMessager().printMessage(Kind.ERROR, msg, element);
  }

  private boolean checkNodeClass(TypeElement node) {
    if (!node.getModifiers().contains(Modifier.FINAL)) {
      error("@ASTNode classes must be final", node);
      return false;
    }

    String interfaceName = interfaceName(ClassName.get(node));
    boolean implementsInterface =
        node.getInterfaces().stream()
            .anyMatch(i -> TypeName.get(i).toString().endsWith(interfaceName));
    if (!implementsInterface) {
      error("Missing interface: " + interfaceName, node);
      return false;
    }
    return true;
  }

  // ASTNodeUtils.accept takes a node, an Optional or an Iterable.
  private boolean isVisitableChild(TypeMirror type) {
    Types types = processingEnv.getTypeUtils();
    TypeMirror erased = types.erasure(type);
    return Stream.of(
            AST_NODE_INTERFACE.canonicalName(),
            Optional.class.getCanonicalName(),
            Iterable.class.getCanonicalName())
        .map(processingEnv.getElementUtils()::getTypeElement)
        .filter(Objects::nonNull)
        .anyMatch(t -> types.isAssignable(erased, types.erasure(t.asType())));
  }

  private MethodSpec.Builder visitorMethod(String name) {
    return MethodSpec.methodBuilder(name)
        .addAnnotation(Override.class)
        .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
        .addTypeVariable(V)
        .returns(V)
        .addParameter(ParameterizedTypeName.get(AST_VISITOR, V), "visitor")
        .addParameter(V, "value");
  }

  private TypeSpec nodeInterface(TypeElement node) {
    ClassName nodeClass = ClassName.get(node);
    TypeSpec.Builder spec =
        TypeSpec.interfaceBuilder(interfaceName(nodeClass))
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(AST_NODE_INTERFACE)
            .addMethod(
                visitorMethod("accept")
                    .addStatement("return visitor.visit(($T) this, value)", nodeClass)
                    .build());

    MethodSpec.Builder visitChildren = visitorMethod("visitChildren");
    for (Element member : node.getEnclosedElements()) {
      if (member.getKind() != ElementKind.METHOD || member.getAnnotation(ASTChild.class) == null) {
        continue;
      }

      ExecutableElement child = (ExecutableElement) member;
      if (child.getAnnotation(Override.class) == null) {
        error("Missing @Override", child);
      }
      if (!child.getParameters().isEmpty() || !isVisitableChild(child.getReturnType())) {
        error("@ASTChild must be a no-arg accessor of a node, Optional or Iterable", child);
        continue;
      }

      String accessor = child.getSimpleName().toString();
      spec.addMethod(
          MethodSpec.methodBuilder(accessor)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(child.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", AST_NODE_UTILS, accessor);
    }
    return spec.addMethod(visitChildren.addStatement("return value").build()).build();
  }

  private void writeVisitors() throws IOException {
    TypeSpec.Builder visitor =
        TypeSpec.interfaceBuilder(AST_VISITOR).addModifiers(Modifier.PUBLIC).addTypeVariable(V);
    TypeSpec.Builder defaultVisitor =
        TypeSpec.classBuilder(DEFAULT_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(AST_VISITOR, V));
    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder(VOID_DEFAULT_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(DEFAULT_VISITOR, VOID));

    for (ClassName node : nodeClasses.values()) {
      visitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .build());
      defaultVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(VOID)
              .addParameter(node, "node")
              .addParameter(VOID, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(node, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }

    write(visitor.build());
    write(defaultVisitor.build());
    write(voidVisitor.build());
  }

  private void write(TypeSpec type) throws IOException {
    JavaFile.builder(PACKAGE, type).build().writeTo(processingEnv.getFiler());
  }
}
