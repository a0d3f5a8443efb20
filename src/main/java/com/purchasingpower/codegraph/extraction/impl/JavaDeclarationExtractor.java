package com.purchasingpower.codegraph.extraction.impl;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.BlockComment;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.comments.JavadocComment;
import com.github.javaparser.ast.comments.LineComment;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.UnknownType;
import com.purchasingpower.codegraph.extraction.CallResolver;
import com.purchasingpower.codegraph.extraction.DeclarationExtractor;
import com.purchasingpower.codegraph.extraction.ImportClassifier;
import com.purchasingpower.codegraph.extraction.SignatureBuilder;
import com.purchasingpower.codegraph.model.extraction.FileOutcome;
import com.purchasingpower.codegraph.model.source.ClassDeclaration;
import com.purchasingpower.codegraph.model.source.DocKind;
import com.purchasingpower.codegraph.model.source.DocRecord;
import com.purchasingpower.codegraph.model.source.DocScope;
import com.purchasingpower.codegraph.model.source.FileRecord;
import com.purchasingpower.codegraph.model.source.ImportRecord;
import com.purchasingpower.codegraph.model.source.InterfaceDeclaration;
import com.purchasingpower.codegraph.model.source.MethodRecord;
import com.purchasingpower.codegraph.model.source.ParameterRecord;
import com.purchasingpower.codegraph.model.source.TypeKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JavaParser implementation of {@link DeclarationExtractor}.
 *
 * <p>Enums and records are recorded as classes. Constructors and annotation
 * type declarations are not extracted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JavaDeclarationExtractor implements DeclarationExtractor {

    private static final ParserConfiguration PARSER_CONFIGURATION = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    private final CallResolver callResolver;
    private final ImportClassifier importClassifier;

    @Override
    public FileOutcome extract(String relativePath, String source) {
        log.debug("📄 Parsing Java file: {}", relativePath);

        // JavaParser instances are not shared between worker threads
        ParseResult<CompilationUnit> result = new JavaParser(PARSER_CONFIGURATION).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String message = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .findFirst()
                    .orElse("Failed to parse " + relativePath);
            log.warn("⚠️  Parse failed for {}: {}", relativePath, message);
            return FileOutcome.failed(relativePath, message);
        }

        try {
            return FileOutcome.parsed(buildFileRecord(relativePath, source, result.getResult().get()));
        } catch (RuntimeException e) {
            log.warn("⚠️  Extraction failed for {}: {}", relativePath, e.getMessage(), e);
            return FileOutcome.failed(relativePath, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private FileRecord buildFileRecord(String path, String source, CompilationUnit cu) {
        List<String> lines = source.lines().collect(Collectors.toList());
        String packageName = extractPackageName(cu);

        List<ClassDeclaration> classes = new ArrayList<>();
        List<InterfaceDeclaration> interfaces = new ArrayList<>();
        List<DocRecord> docs = new ArrayList<>();
        extractFileHeader(cu, path).ifPresent(docs::add);

        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            if (type.isClassOrInterfaceDeclaration() && type.asClassOrInterfaceDeclaration().isInterface()) {
                interfaces.add(buildInterface(type.asClassOrInterfaceDeclaration(), packageName, path));
                extractJavadoc(type, DocScope.INTERFACE, type.getNameAsString(), path).ifPresent(docs::add);
            } else if (type.isClassOrInterfaceDeclaration() || type.isEnumDeclaration() || type.isRecordDeclaration()) {
                classes.add(buildClass(type, packageName, path));
                extractJavadoc(type, DocScope.CLASS, type.getNameAsString(), path).ifPresent(docs::add);
            }
        }

        List<MethodRecord> methods = new ArrayList<>();
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            MethodRecord record = buildMethod(method, packageName, path, lines);
            methods.add(record);
            extractJavadoc(method, DocScope.METHOD, record.getMethodSignature(), path).ifPresent(docs::add);
            docs.addAll(extractLineComments(method, record.getMethodSignature(), path));
        }

        for (InterfaceDeclaration iface : interfaces) {
            iface.setMethodCount((int) methods.stream()
                    .filter(m -> m.getContainingType() == TypeKind.INTERFACE)
                    .filter(m -> iface.getName().equals(m.getClassName()))
                    .count());
        }

        List<ImportRecord> imports = cu.getImports().stream()
                .map(imp -> buildImport(imp, path))
                .collect(Collectors.toList());

        FileRecord record = FileRecord.builder()
                .path(path)
                .packageName(packageName)
                .code(source)
                .methods(methods)
                .classes(classes)
                .interfaces(interfaces)
                .imports(imports)
                .docs(docs)
                .totalLines(lines.size())
                .codeLines(countCodeLines(lines))
                .methodCount(methods.size())
                .classCount(classes.size())
                .interfaceCount(interfaces.size())
                .build();

        log.debug("✅ Parsed {}: {} classes, {} interfaces, {} methods, {} imports",
                path, classes.size(), interfaces.size(), methods.size(), imports.size());
        return record;
    }

    private String extractPackageName(CompilationUnit cu) {
        return cu.getPackageDeclaration()
                .map(pd -> pd.getNameAsString())
                .orElse(null);
    }

    private ImportRecord buildImport(ImportDeclaration imp, String path) {
        String importPath = imp.getNameAsString();
        return ImportRecord.builder()
                .importPath(importPath)
                .isStatic(imp.isStatic())
                .isWildcard(imp.isAsterisk())
                .importType(importClassifier.classify(importPath))
                .file(path)
                .build();
    }

    private ClassDeclaration buildClass(TypeDeclaration<?> type, String packageName, String path) {
        List<String> modifiers = extractModifiers(type.getModifiers());
        String extendsType = null;
        List<String> implementsTypes = List.of();
        boolean implicitlyFinal = false;

        if (type.isClassOrInterfaceDeclaration()) {
            ClassOrInterfaceDeclaration cls = type.asClassOrInterfaceDeclaration();
            extendsType = cls.getExtendedTypes().stream()
                    .findFirst()
                    .map(ClassOrInterfaceType::getNameWithScope)
                    .orElse(null);
            implementsTypes = typeNames(cls.getImplementedTypes());
        } else if (type.isEnumDeclaration()) {
            EnumDeclaration enumDecl = type.asEnumDeclaration();
            implementsTypes = typeNames(enumDecl.getImplementedTypes());
            implicitlyFinal = true;
        } else if (type.isRecordDeclaration()) {
            RecordDeclaration recordDecl = type.asRecordDeclaration();
            implementsTypes = typeNames(recordDecl.getImplementedTypes());
            implicitlyFinal = true;
        }

        return ClassDeclaration.builder()
                .name(type.getNameAsString())
                .file(path)
                .packageName(packageName)
                .line(beginLine(type))
                .modifiers(modifiers)
                .extendsType(extendsType)
                .implementsTypes(new ArrayList<>(implementsTypes))
                .isAbstract(modifiers.contains("abstract"))
                .isFinal(implicitlyFinal || modifiers.contains("final"))
                .estimatedLines(spanLength(type))
                .build();
    }

    private InterfaceDeclaration buildInterface(ClassOrInterfaceDeclaration iface, String packageName, String path) {
        return InterfaceDeclaration.builder()
                .name(iface.getNameAsString())
                .file(path)
                .packageName(packageName)
                .line(beginLine(iface))
                .modifiers(extractModifiers(iface.getModifiers()))
                .extendsTypes(new ArrayList<>(typeNames(iface.getExtendedTypes())))
                .estimatedLines(spanLength(iface))
                .build();
    }

    private MethodRecord buildMethod(MethodDeclaration method, String packageName, String path, List<String> lines) {
        Optional<TypeDeclaration<?>> enclosing = findEnclosingType(method);
        String className = enclosing.map(TypeDeclaration::getNameAsString).orElse(null);
        TypeKind containingType = enclosing.map(this::kindOf).orElse(null);

        List<ParameterRecord> parameters = extractParameters(method);
        List<String> modifiers = extractModifiers(method.getModifiers());
        String returnType = method.getTypeAsString();

        int startLine = beginLine(method);
        int endLine = method.getBody()
                .flatMap(body -> body.getStatements().getLast())
                .flatMap(Node::getEnd)
                .map(pos -> pos.line)
                .orElse(startLine);

        String body = method.getBody()
                .map(block -> slice(withoutNestedTypes(lines, block), block))
                .orElse("");

        return MethodRecord.builder()
                .name(method.getNameAsString())
                .className(className)
                .containingType(containingType)
                .line(startLine)
                .endLine(endLine)
                .code(sliceLines(lines, startLine, endLine))
                .file(path)
                .estimatedLines(endLine - startLine + 1)
                .parameters(parameters)
                .modifiers(modifiers)
                .isStatic(modifiers.contains("static"))
                .isAbstract(modifiers.contains("abstract"))
                .isFinal(modifiers.contains("final"))
                .isPrivate(modifiers.contains("private"))
                .isPublic(modifiers.contains("public"))
                .returnType(returnType)
                .calls(new ArrayList<>(callResolver.resolve(body, className)))
                .methodSignature(SignatureBuilder.build(packageName, className, method.getNameAsString(),
                        parameters.stream().map(ParameterRecord::getType).collect(Collectors.toList()),
                        returnType))
                .build();
    }

    private Optional<TypeDeclaration<?>> findEnclosingType(Node node) {
        Optional<Node> current = node.getParentNode();
        while (current.isPresent()) {
            if (current.get() instanceof TypeDeclaration<?> type) {
                return Optional.of(type);
            }
            current = current.get().getParentNode();
        }
        return Optional.empty();
    }

    private TypeKind kindOf(TypeDeclaration<?> type) {
        if (type.isClassOrInterfaceDeclaration() && type.asClassOrInterfaceDeclaration().isInterface()) {
            return TypeKind.INTERFACE;
        }
        return TypeKind.CLASS;
    }

    private List<ParameterRecord> extractParameters(MethodDeclaration method) {
        return method.getParameters().stream()
                .map(p -> ParameterRecord.builder()
                        .name(p.getNameAsString())
                        .type(parameterType(p))
                        .build())
                .collect(Collectors.toList());
    }

    private String parameterType(Parameter parameter) {
        if (parameter.getType() instanceof UnknownType) {
            return null;
        }
        String type = parameter.getTypeAsString();
        return parameter.isVarArgs() ? type + "..." : type;
    }

    private List<String> extractModifiers(NodeList<Modifier> modifiers) {
        return modifiers.stream()
                .map(m -> m.getKeyword().asString())
                .collect(Collectors.toList());
    }

    private List<String> typeNames(NodeList<ClassOrInterfaceType> types) {
        return types.stream()
                .map(ClassOrInterfaceType::getNameWithScope)
                .collect(Collectors.toList());
    }

    private Optional<DocRecord> extractFileHeader(CompilationUnit cu, String path) {
        Optional<Comment> header = cu.getComment()
                .or(() -> cu.getPackageDeclaration().flatMap(Node::getComment));
        return header.map(comment -> buildDoc(comment, DocScope.FILE, null, path));
    }

    private Optional<DocRecord> extractJavadoc(Node node, DocScope scope, String owner, String path) {
        return node.getComment()
                .filter(Comment::isJavadocComment)
                .map(comment -> buildDoc(comment, scope, owner, path));
    }

    private List<DocRecord> extractLineComments(MethodDeclaration method, String signature, String path) {
        return method.getBody()
                .map(BlockStmt::getAllContainedComments)
                .orElse(List.of())
                .stream()
                .filter(Comment::isLineComment)
                .filter(comment -> isOwnedBy(comment, method))
                .map(comment -> buildDoc(comment, DocScope.METHOD, signature, path))
                .collect(Collectors.toList());
    }

    /**
     * Whether the nearest method around a comment is {@code method} rather than
     * one declared in a nested anonymous or local class.
     */
    private boolean isOwnedBy(Comment comment, MethodDeclaration method) {
        Optional<Node> current = comment.getCommentedNode().or(comment::getParentNode);
        while (current.isPresent()) {
            if (current.get() instanceof MethodDeclaration declaration) {
                return declaration == method;
            }
            current = current.get().getParentNode();
        }
        return false;
    }

    private DocRecord buildDoc(Comment comment, DocScope scope, String owner, String path) {
        DocKind kind;
        String text;
        if (comment instanceof JavadocComment javadoc) {
            kind = DocKind.JAVADOC;
            text = javadoc.parse().toText();
        } else if (comment instanceof LineComment) {
            kind = DocKind.LINE_COMMENT;
            text = comment.getContent();
        } else if (comment instanceof BlockComment) {
            kind = DocKind.BLOCK_COMMENT;
            text = stripLeadingStars(comment.getContent());
        } else {
            kind = DocKind.BLOCK_COMMENT;
            text = comment.getContent();
        }
        int start = beginLine(comment);
        return DocRecord.builder()
                .kind(kind)
                .scope(scope)
                .text(text.strip())
                .startLine(start)
                .endLine(comment.getEnd().map(pos -> pos.line).orElse(start))
                .file(path)
                .owner(owner)
                .build();
    }

    private String stripLeadingStars(String content) {
        return content.lines()
                .map(line -> line.strip().startsWith("*") ? line.strip().substring(1).strip() : line.strip())
                .collect(Collectors.joining("\n"));
    }

    private int countCodeLines(List<String> lines) {
        return (int) lines.stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("//"))
                .count();
    }

    private int beginLine(Node node) {
        return node.getBegin().map(pos -> pos.line).orElse(0);
    }

    private int spanLength(Node node) {
        int begin = beginLine(node);
        return node.getEnd().map(pos -> pos.line - begin + 1).orElse(0);
    }

    private String sliceLines(List<String> lines, int startLine, int endLine) {
        if (startLine < 1 || startLine > lines.size()) {
            return "";
        }
        return String.join("\n", lines.subList(startLine - 1, Math.min(endLine, lines.size())));
    }

    /**
     * Source lines with the members of anonymous classes and local type
     * declarations inside {@code block} replaced by spaces. Those members are
     * methods of their own, so their calls must not count for the outer method.
     */
    private List<String> withoutNestedTypes(List<String> lines, BlockStmt block) {
        List<Node> nested = new ArrayList<>();
        block.findAll(ObjectCreationExpr.class).forEach(creation ->
                creation.getAnonymousClassBody().ifPresent(nested::addAll));
        nested.addAll(block.findAll(LocalClassDeclarationStmt.class));
        nested.addAll(block.findAll(LocalRecordDeclarationStmt.class));
        if (nested.isEmpty()) {
            return lines;
        }
        List<String> blanked = new ArrayList<>(lines);
        nested.forEach(node -> blank(blanked, node));
        return blanked;
    }

    private void blank(List<String> lines, Node node) {
        if (node.getBegin().isEmpty() || node.getEnd().isEmpty()) {
            return;
        }
        Position begin = node.getBegin().get();
        Position end = node.getEnd().get();
        for (int line = begin.line; line <= Math.min(end.line, lines.size()); line++) {
            String text = lines.get(line - 1);
            int from = line == begin.line ? Math.min(begin.column - 1, text.length()) : 0;
            int to = line == end.line ? Math.min(end.column, text.length()) : text.length();
            if (from < to) {
                lines.set(line - 1, text.substring(0, from) + " ".repeat(to - from) + text.substring(to));
            }
        }
    }

    /**
     * Exact source text of a node, columns included.
     */
    private String slice(List<String> lines, Node node) {
        Optional<Position> begin = node.getBegin();
        Optional<Position> end = node.getEnd();
        if (begin.isEmpty() || end.isEmpty() || end.get().line > lines.size()) {
            return "";
        }
        int firstLine = begin.get().line;
        int lastLine = end.get().line;
        if (firstLine == lastLine) {
            String line = lines.get(firstLine - 1);
            return line.substring(Math.min(begin.get().column - 1, line.length()),
                    Math.min(end.get().column, line.length()));
        }
        StringBuilder text = new StringBuilder();
        String first = lines.get(firstLine - 1);
        text.append(first.substring(Math.min(begin.get().column - 1, first.length())));
        for (int i = firstLine; i < lastLine - 1; i++) {
            text.append('\n').append(lines.get(i));
        }
        String last = lines.get(lastLine - 1);
        text.append('\n').append(last, 0, Math.min(end.get().column, last.length()));
        return text.toString();
    }
}
