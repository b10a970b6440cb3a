package xmlc.processor;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
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
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableList;
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
 * Generates, for every {@link ASTNode} class, an {@code _ASTNode} interface implementing {@code
 * accept} and {@code visitChildren}, plus the {@code ASTVisitor}, {@code DefaultASTVisitor} and
 * {@code VoidDefaultASTVisitor} types covering all of them.
 *
 * <p>All nodes must be declared in one package and in one compilation round.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final TypeVariableName V = TypeVariableName.get("V");

  private boolean visitorsWritten = false;

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
    if (roundEnv.processingOver()) {
      return true;
    }

    ImmutableList<TypeElement> nodes =
        ElementFilter.typesIn(roundEnv.getElementsAnnotatedWith(ASTNode.class))
            .stream()
            .sorted(Comparator.comparing(e -> e.getQualifiedName().toString()))
            .collect(ImmutableList.toImmutableList());
    if (nodes.isEmpty()) {
      return true;
    }
    if (visitorsWritten) {
      for (TypeElement node : nodes) {
        error("@ASTNode classes must be compiled together with the first batch", node);
      }
      return true;
    }

    String packageName = packageOf(nodes.get(0));
    for (TypeElement node : nodes) {
      if (!packageOf(node).equals(packageName)) {
        error("All @ASTNode classes must be declared in package " + packageName, node);
        return true;
      }
    }

    try {
      for (TypeElement node : nodes) {
        writeASTNodeFile(packageName, node);
      }
      writeVisitorFiles(packageName, nodes);
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }
    visitorsWritten = true;
    return true;
  }

  private void error(String msg, Element element) {
    processingEnv.getMessager().printMessage(Kind.ERROR, msg, element);
  }

  private String packageOf(Element element) {
    return processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();
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

  private static TypeElement superclassOf(TypeElement element) {
    TypeMirror superclass = element.getSuperclass();
    if (superclass.getKind() != TypeKind.DECLARED) {
      return null;
    }
    return (TypeElement) ((DeclaredType) superclass).asElement();
  }

  // Children declared on the node first, then those inherited from abstract bases.
  private List<ExecutableElement> childAccessors(TypeElement element) {
    List<ExecutableElement> accessors = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (TypeElement type = element; type != null; type = superclassOf(type)) {
      for (ExecutableElement method : ElementFilter.methodsIn(type.getEnclosedElements())) {
        if (method.getAnnotation(ASTChild.class) == null) continue;
        if (!seen.add(method.getSimpleName().toString())) continue;
        if (type == element && method.getAnnotation(Override.class) == null) {
          error("Missing @Override", method);
        }
        if (!method.getParameters().isEmpty()) {
          error("@ASTChild accessors take no parameters", method);
        }
        accessors.add(method);
      }
    }
    return accessors;
  }

  private static ParameterSpec visitorParameter(ClassName visitorName, TypeName valueType) {
    return ParameterSpec.builder(ParameterizedTypeName.get(visitorName, valueType), "visitor")
        .build();
  }

  private void writeASTNodeFile(String packageName, TypeElement element) throws IOException {
    String interfaceName = getASTNodeClassName(element);
    if (!element
        .getInterfaces()
        .stream()
        .anyMatch(i -> TypeName.get(i).toString().endsWith(interfaceName))) {
      error("Missing interface: " + interfaceName, element);
      return;
    }

    ClassName visitorName = ClassName.get(packageName, "ASTVisitor");
    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(ClassName.get(packageName, "ASTNodeInterface"));

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorParameter(visitorName, V))
            .addParameter(V, "value")
            .addStatement("return visitor.visit(($T) this, value)", ClassName.get(element))
            .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorParameter(visitorName, V))
            .addParameter(V, "value");
    for (ExecutableElement method : childAccessors(element)) {
      String name = method.getSimpleName().toString();
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(name)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)",
          ClassName.get(packageName, "ASTNodeUtils"),
          name);
    }
    typeSpecBuilder.addMethod(visitChildren.addStatement("return value").build());

    writeJavaFile(packageName, typeSpecBuilder.build(), element);
  }

  private void writeVisitorFiles(String packageName, List<TypeElement> nodes) throws IOException {
    ClassName visitorName = ClassName.get(packageName, "ASTVisitor");
    ClassName defaultVisitorName = ClassName.get(packageName, "DefaultASTVisitor");
    TypeName voidType = ClassName.get(Void.class);

    TypeSpec.Builder visitor =
        TypeSpec.interfaceBuilder(visitorName).addModifiers(Modifier.PUBLIC).addTypeVariable(V);
    TypeSpec.Builder defaultVisitor =
        TypeSpec.classBuilder(defaultVisitorName)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(visitorName, V));
    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder("VoidDefaultASTVisitor")
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(defaultVisitorName, voidType));

    for (TypeElement node : nodes) {
      ClassName nodeName = ClassName.get(node);
      visitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(nodeName, "node")
              .addParameter(V, "value")
              .build());
      defaultVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(nodeName, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(voidType)
              .addParameter(nodeName, "node")
              .addParameter(voidType, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(nodeName, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }

    TypeElement origin = nodes.get(0);
    writeJavaFile(packageName, visitor.build(), origin);
    writeJavaFile(packageName, defaultVisitor.build(), origin);
    writeJavaFile(packageName, voidVisitor.build(), origin);
  }

  private void writeJavaFile(String packageName, TypeSpec typeSpec, Element origin)
      throws IOException {
    JavaFile.builder(packageName, typeSpec.toBuilder().addOriginatingElement(origin).build())
        .build()
        .writeTo(processingEnv.getFiler());
  }
}
