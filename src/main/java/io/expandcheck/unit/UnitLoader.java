package io.expandcheck.unit;

import io.expandcheck.model.CallArgument;
import io.expandcheck.model.CallExpression;
import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.Expression;
import io.expandcheck.model.Labels;
import io.expandcheck.model.ModuleId;
import io.expandcheck.model.ParameterDeclaration;
import io.expandcheck.model.Signature;
import io.expandcheck.model.SiteContext;
import io.expandcheck.model.TypeDeclaration;
import io.expandcheck.model.TypeKind;
import io.expandcheck.model.TypeRef;
import io.expandcheck.model.VisibilityLevel;
import io.expandcheck.symbols.SymbolTable;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a unit description from YAML.
 * <pre>
 * module: App                 # default module for every entry
 * file: main.swift            # default file for every entry
 * types:
 *   - name: Point
 *     kind: struct            # struct | class | abstract_class | interface
 *     module: Geometry
 *     supertype: Shape
 *     constructors:
 *       - parameters: [{label: x, type: Int}, {label: y, type: Int}]
 *         visibility: public  # public | internal | fileprivate | private
 *         sequence: 3
 * functions:
 *   - name: draw
 *     typeParameters: [T]
 *     parameters:
 *       - {label: at, type: Point, expanded: true}
 *       - {label: color, type: Color, default: true}
 * calls:
 *   - callee: draw
 *     arguments:
 *       - {label: x, value: "1", type: Int}
 * </pre>
 * Entries without an explicit {@code sequence} are numbered in document order
 * (types and their constructors, then functions, then calls). A label that is
 * absent, null or {@code _} is unlabeled.
 */
public class UnitLoader {

    private static final String DEFAULT_MODULE = "Main";

    private long nextSequence;

    /**
     * Load a unit description from a YAML file.
     */
    public CompilationUnit load(Path unitPath) throws IOException {
        try (InputStream in = Files.newInputStream(unitPath)) {
            return load(in, unitPath.getFileName().toString());
        }
    }

    @SuppressWarnings("unchecked")
    public CompilationUnit load(InputStream in, String unitName) throws IOException {
        Object loaded;
        try {
            loaded = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new UnitFormatException("Invalid YAML in " + unitName + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            throw new UnitFormatException("Empty unit file: " + unitName);
        }
        if (!(loaded instanceof Map)) {
            throw new UnitFormatException("Unit file must be a mapping at the top level: " + unitName);
        }
        Map<String, Object> data = (Map<String, Object>) loaded;

        nextSequence = 1;
        Defaults defaults = new Defaults(
            stringOr(data, "module", DEFAULT_MODULE),
            stringOr(data, "file", unitName)
        );

        SymbolTable symbols = new SymbolTable();
        List<Map<String, Object>> types = listOf(data, "types", "");
        for (int i = 0; i < types.size(); i++) {
            loadType(types.get(i), "types[" + i + "]", defaults, symbols);
        }

        List<Map<String, Object>> functions = listOf(data, "functions", "");
        List<PendingSignature> pending = new ArrayList<>();
        for (int i = 0; i < functions.size(); i++) {
            pending.add(loadFunction(functions.get(i), "functions[" + i + "]", defaults));
        }
        List<Signature> signatures = resolveOverloadSets(pending);

        List<Map<String, Object>> callEntries = listOf(data, "calls", "");
        List<CallExpression> calls = new ArrayList<>();
        for (int i = 0; i < callEntries.size(); i++) {
            calls.add(loadCall(callEntries.get(i), "calls[" + i + "]", defaults));
        }

        return new CompilationUnit(unitName, symbols, signatures, calls);
    }

    private void loadType(Map<String, Object> entry, String path, Defaults defaults, SymbolTable symbols)
            throws UnitFormatException {
        TypeRef.Named type = new TypeRef.Named(requireString(entry, "name", path));
        String module = stringOr(entry, "module", defaults.module());
        String supertype = stringOr(entry, "supertype", null);
        TypeKind kind = parseKind(stringOr(entry, "kind", "struct"), path);

        symbols.register(new TypeDeclaration(
            type,
            kind,
            supertype != null ? new TypeRef.Named(supertype) : null,
            ModuleId.of(module)
        ));

        List<Map<String, Object>> constructors = listOf(entry, "constructors", path);
        for (int i = 0; i < constructors.size(); i++) {
            String ctorPath = path + ".constructors[" + i + "]";
            Map<String, Object> ctor = constructors.get(i);

            ConstructorCandidate.Builder builder = ConstructorCandidate.builder()
                .owningType(type)
                .visibility(parseVisibility(stringOr(ctor, "visibility", "internal"), ctorPath))
                .declaringModule(stringOr(ctor, "module", module))
                .declaringFile(stringOr(ctor, "file", defaults.file()))
                .sequence(sequenceOf(ctor, ctorPath));

            List<Map<String, Object>> params = listOf(ctor, "parameters", ctorPath);
            for (int p = 0; p < params.size(); p++) {
                String paramPath = ctorPath + ".parameters[" + p + "]";
                Map<String, Object> param = params.get(p);
                builder.parameter(labelOf(param), parseType(requireString(param, "type", paramPath), Set.of(), paramPath));
            }
            symbols.register(builder.build());
        }
    }

    private PendingSignature loadFunction(Map<String, Object> entry, String path, Defaults defaults)
            throws UnitFormatException {
        String name = requireString(entry, "name", path);
        SiteContext site = siteOf(entry, path, defaults);
        Set<String> typeParameters = new LinkedHashSet<>(stringList(entry, "typeParameters", path));

        List<ParameterDeclaration> parameters = new ArrayList<>();
        List<Map<String, Object>> params = listOf(entry, "parameters", path);
        for (int i = 0; i < params.size(); i++) {
            String paramPath = path + ".parameters[" + i + "]";
            Map<String, Object> param = params.get(i);
            parameters.add(ParameterDeclaration.builder()
                .label(labelOf(param))
                .positionalIndex(i)
                .declaredType(parseType(requireString(param, "type", paramPath), typeParameters, paramPath))
                .expanded(booleanOr(param, "expanded", false, paramPath))
                .hasDefaultValue(booleanOr(param, "default", false, paramPath))
                .byReference(booleanOr(param, "inout", false, paramPath))
                .build());
        }
        return new PendingSignature(name, parameters, site);
    }

    private CallExpression loadCall(Map<String, Object> entry, String path, Defaults defaults)
            throws UnitFormatException {
        String callee = requireString(entry, "callee", path);
        SiteContext site = siteOf(entry, path, defaults);

        List<CallArgument> arguments = new ArrayList<>();
        List<Map<String, Object>> args = listOf(entry, "arguments", path);
        for (int i = 0; i < args.size(); i++) {
            String argPath = path + ".arguments[" + i + "]";
            Map<String, Object> arg = args.get(i);
            Object value = arg.get("value");
            if (value == null) {
                throw new UnitFormatException(argPath + ": missing 'value'");
            }
            String typeText = stringOr(arg, "type", null);
            Expression expression = new Expression(
                String.valueOf(value),
                typeText != null ? parseType(typeText, Set.of(), argPath) : null
            );
            arguments.add(new CallArgument(labelOf(arg), expression, booleanOr(arg, "trailingClosure", false, argPath)));
        }
        return new CallExpression(callee, arguments, site);
    }

    /**
     * A function has sibling overloads when another function shares its name,
     * module and enclosing type.
     */
    private List<Signature> resolveOverloadSets(List<PendingSignature> pending) {
        Map<List<Object>, Integer> counts = new HashMap<>();
        for (PendingSignature p : pending) {
            counts.merge(p.overloadKey(), 1, Integer::sum);
        }
        return pending.stream()
            .map(p -> new Signature(p.name(), p.parameters(), counts.get(p.overloadKey()) > 1, p.site()))
            .toList();
    }

    private SiteContext siteOf(Map<String, Object> entry, String path, Defaults defaults) throws UnitFormatException {
        return new SiteContext(
            ModuleId.of(stringOr(entry, "module", defaults.module())),
            stringOr(entry, "file", defaults.file()),
            stringOr(entry, "enclosingType", null),
            sequenceOf(entry, path)
        );
    }

    private long sequenceOf(Map<String, Object> entry, String path) throws UnitFormatException {
        long assigned = nextSequence++;
        Object value = entry.get("sequence");
        if (value == null) {
            return assigned;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        throw new UnitFormatException(path + ": 'sequence' must be a number, got: " + value);
    }

    private static String labelOf(Map<String, Object> entry) {
        Object label = entry.get("label");
        if (label == null) {
            return null;
        }
        String text = String.valueOf(label).trim();
        return text.isEmpty() || Labels.UNLABELED.equals(text) ? null : text;
    }

    private static TypeRef parseType(String text, Set<String> typeParameters, String path) throws UnitFormatException {
        try {
            return TypeRefParser.parse(text, typeParameters);
        } catch (IllegalArgumentException e) {
            throw new UnitFormatException(path + ": " + e.getMessage(), e);
        }
    }

    private static TypeKind parseKind(String value, String path) throws UnitFormatException {
        return switch (value.toLowerCase()) {
            case "struct" -> TypeKind.STRUCT;
            case "class" -> TypeKind.CLASS;
            case "abstract_class", "abstract" -> TypeKind.ABSTRACT_CLASS;
            case "interface", "protocol" -> TypeKind.INTERFACE;
            default -> throw new UnitFormatException(path + ": unknown kind '" + value
                + "' (expected struct, class, abstract_class or interface)");
        };
    }

    private static VisibilityLevel parseVisibility(String value, String path) throws UnitFormatException {
        return switch (value.toLowerCase()) {
            case "public", "open" -> VisibilityLevel.PUBLIC;
            case "internal" -> VisibilityLevel.INTERNAL;
            case "fileprivate", "file_private" -> VisibilityLevel.FILE_PRIVATE;
            case "private" -> VisibilityLevel.PRIVATE;
            default -> throw new UnitFormatException(path + ": unknown visibility '" + value
                + "' (expected public, internal, fileprivate or private)");
        };
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOf(Map<String, Object> entry, String key, String path)
            throws UnitFormatException {
        Object value = entry.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new UnitFormatException(qualify(path, key) + " must be a list");
        }
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new UnitFormatException(qualify(path, key) + " entries must be mappings, got: " + item);
            }
        }
        return (List<Map<String, Object>>) list;
    }

    private static List<String> stringList(Map<String, Object> entry, String key, String path)
            throws UnitFormatException {
        Object value = entry.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new UnitFormatException(qualify(path, key) + " must be a list");
        }
        return list.stream().filter(Objects::nonNull).map(String::valueOf).map(String::trim).toList();
    }

    private static String requireString(Map<String, Object> entry, String key, String path)
            throws UnitFormatException {
        String value = stringOr(entry, key, null);
        if (value == null || value.isBlank()) {
            throw new UnitFormatException(path + ": missing '" + key + "'");
        }
        return value;
    }

    private static String stringOr(Map<String, Object> entry, String key, String fallback) {
        Object value = entry.get(key);
        return value != null ? String.valueOf(value).trim() : fallback;
    }

    private static boolean booleanOr(Map<String, Object> entry, String key, boolean fallback, String path)
            throws UnitFormatException {
        Object value = entry.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new UnitFormatException(path + ": '" + key + "' must be true or false, got: " + value);
    }

    private static String qualify(String path, String key) {
        return path.isEmpty() ? "'" + key + "'" : path + "." + key;
    }

    private record Defaults(String module, String file) {}

    private record PendingSignature(String name, List<ParameterDeclaration> parameters, SiteContext site) {
        List<Object> overloadKey() {
            return Arrays.asList(name, site.module(), site.enclosingType());
        }
    }
}
