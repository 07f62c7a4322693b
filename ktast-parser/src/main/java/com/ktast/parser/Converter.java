package com.ktast.parser;

import com.ktast.ast.Node;
import com.ktast.ast.Statement;
import com.ktast.ast.decl.*;
import com.ktast.ast.expr.*;
import com.ktast.ast.modifier.*;
import com.ktast.ast.type.*;
import com.ktast.parser.lexer.TokenType;
import com.ktast.parser.tree.SyntaxKind;
import com.ktast.parser.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 原始语法树到语法树节点的转换
 *
 * <p>每种原始节点对应一个 convertX 方法。产生的每个节点都经过 {@link #onNode}，
 * 子类借此记录节点与原始节点的对应关系。</p>
 */
public class Converter {

    private static final Map<String, Keyword.Type> KEYWORDS_BY_TEXT;

    static {
        Map<String, Keyword.Type> map = new HashMap<String, Keyword.Type>();
        for (Keyword.Type type : Keyword.Type.values()) {
            map.put(type.getText(), type);
        }
        KEYWORDS_BY_TEXT = Collections.unmodifiableMap(map);
    }

    public KotlinFile convertFile(SyntaxNode raw) {
        requireKind(raw, SyntaxKind.FILE);
        Cursor c = new Cursor(raw);
        List<AnnotationSet> annotationSets = convertFileAnnotations(c);
        PackageDirective packageDirective = c.at(SyntaxKind.PACKAGE_DIRECTIVE) ? convertPackage(c.next()) : null;
        List<ImportDirective> imports = convertImports(c);
        List<Declaration> declarations = new ArrayList<Declaration>();
        while (c.hasNext()) {
            declarations.add(convertDeclaration(c.next()));
        }
        return onNode(new KotlinFile(annotationSets, packageDirective, imports, declarations), raw);
    }

    public KotlinScript convertScript(SyntaxNode raw) {
        requireKind(raw, SyntaxKind.SCRIPT);
        Cursor c = new Cursor(raw);
        List<AnnotationSet> annotationSets = convertFileAnnotations(c);
        PackageDirective packageDirective = c.at(SyntaxKind.PACKAGE_DIRECTIVE) ? convertPackage(c.next()) : null;
        List<ImportDirective> imports = convertImports(c);
        List<Statement> statements = new ArrayList<Statement>();
        while (c.hasNext()) {
            statements.add(convertStatement(c.next()));
        }
        return onNode(new KotlinScript(annotationSets, packageDirective, imports, statements), raw);
    }

    /**
     * 每产生一个节点调用一次，返回值替代该节点
     */
    protected <T extends Node> T onNode(T node, SyntaxNode raw) {
        return node;
    }

    // ============ 文件头 ============

    private List<AnnotationSet> convertFileAnnotations(Cursor c) {
        List<AnnotationSet> result = new ArrayList<AnnotationSet>();
        while (c.at(SyntaxKind.ANNOTATION_SET)) {
            result.add(convertAnnotationSet(c.next()));
        }
        return result;
    }

    private List<ImportDirective> convertImports(Cursor c) {
        List<ImportDirective> result = new ArrayList<ImportDirective>();
        while (c.at(SyntaxKind.IMPORT_DIRECTIVE)) {
            result.add(convertImport(c.next()));
        }
        return result;
    }

    protected PackageDirective convertPackage(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword packageKeyword = convertKeyword(c.next());
        List<NameExpression> names = new ArrayList<NameExpression>();
        while (c.hasNext()) {
            SyntaxNode child = c.next();
            if (!child.is(TokenType.DOT)) {
                names.add(convertName(child));
            }
        }
        return onNode(new PackageDirective(packageKeyword, names), raw);
    }

    protected ImportDirective convertImport(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword importKeyword = convertKeyword(c.next());
        List<NameExpression> names = new ArrayList<NameExpression>();
        Keyword asterisk = null;
        ImportDirective.ImportAlias alias = null;
        while (c.hasNext()) {
            SyntaxNode child = c.next();
            if (child.is(TokenType.IDENTIFIER)) {
                names.add(convertName(child));
            } else if (child.is(TokenType.MUL)) {
                asterisk = convertKeyword(child);
            } else if (child.is(SyntaxKind.IMPORT_ALIAS)) {
                alias = convertImportAlias(child);
            }
        }
        return onNode(new ImportDirective(importKeyword, names, asterisk, alias), raw);
    }

    protected ImportDirective.ImportAlias convertImportAlias(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword asKeyword = convertKeyword(c.next());
        return onNode(new ImportDirective.ImportAlias(asKeyword, convertName(c.next())), raw);
    }

    // ============ 声明 ============

    protected Statement convertStatement(SyntaxNode raw) {
        if (isDeclaration(raw)) {
            return convertDeclaration(raw);
        }
        return convertExpression(raw);
    }

    private static boolean isDeclaration(SyntaxNode raw) {
        if (raw.isLeaf()) return false;
        switch (raw.getKind()) {
            case CLASS:
            case FUN:
            case PROPERTY:
            case TYPEALIAS:
            case SECONDARY_CONSTRUCTOR:
            case CLASS_INITIALIZER:
                return true;
            default:
                return false;
        }
    }

    protected Declaration convertDeclaration(SyntaxNode raw) {
        if (!raw.isLeaf()) {
            switch (raw.getKind()) {
                case CLASS:
                    return convertClass(raw);
                case FUN:
                    return convertFunction(raw);
                case PROPERTY:
                    return convertProperty(raw);
                case TYPEALIAS:
                    return convertTypeAlias(raw);
                case SECONDARY_CONSTRUCTOR:
                    return convertSecondaryConstructor(raw);
                case CLASS_INITIALIZER:
                    return convertInit(raw);
                default:
                    break;
            }
        }
        throw new IllegalStateException("Unexpected declaration " + raw);
    }

    protected ClassDeclaration convertClass(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        Keyword declarationKeyword = convertKeyword(c.next());
        NameExpression name = c.at(TokenType.IDENTIFIER) ? convertName(c.next()) : null;
        TypeParams typeParams = c.at(SyntaxKind.TYPE_PARAMETER_LIST) ? convertTypeParams(c.next()) : null;
        ClassDeclaration.PrimaryConstructor constructor = c.at(SyntaxKind.PRIMARY_CONSTRUCTOR)
                ? convertPrimaryConstructor(c.next()) : null;
        ClassDeclaration.ClassParents parents = null;
        if (c.skip(TokenType.COLON)) {
            parents = convertClassParents(c.expect(SyntaxKind.SUPER_TYPE_LIST));
        }
        TypeConstraintSet constraints = c.at(SyntaxKind.TYPE_CONSTRAINT_SET)
                ? convertTypeConstraintSet(c.next()) : null;
        ClassDeclaration.ClassBody body = c.at(SyntaxKind.CLASS_BODY) ? convertClassBody(c.next()) : null;
        return onNode(new ClassDeclaration(modifiers, declarationKeyword, name, typeParams, constructor, parents,
                constraints, body), raw);
    }

    protected ClassDeclaration.PrimaryConstructor convertPrimaryConstructor(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        Keyword constructorKeyword = c.atSoft("constructor") ? convertKeyword(c.next()) : null;
        FunctionParams params = c.at(SyntaxKind.VALUE_PARAMETER_LIST) ? convertFunctionParams(c.next()) : null;
        return onNode(new ClassDeclaration.PrimaryConstructor(modifiers, constructorKeyword, params), raw);
    }

    protected ClassDeclaration.ClassParents convertClassParents(SyntaxNode raw) {
        List<ClassDeclaration.ClassParent> parents = new ArrayList<ClassDeclaration.ClassParent>();
        for (SyntaxNode child : new Cursor(raw).rest()) {
            if (child.is(TokenType.COMMA)) continue;
            parents.add(convertClassParent(child));
        }
        return onNode(new ClassDeclaration.ClassParents(parents), raw);
    }

    private ClassDeclaration.ClassParent convertClassParent(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        TypeRef type = convertTypeRef(c.expect(SyntaxKind.TYPE_REFERENCE));
        switch (raw.getKind()) {
            case SUPER_TYPE_CALL_ENTRY:
                return onNode(new ClassDeclaration.CallConstructorParent(type,
                        convertValueArgs(c.expect(SyntaxKind.VALUE_ARGUMENT_LIST))), raw);
            case DELEGATED_SUPER_TYPE_ENTRY:
                Keyword byKeyword = convertKeyword(c.next());
                return onNode(new ClassDeclaration.DelegationParent(type, byKeyword, convertExpression(c.next())), raw);
            case SUPER_TYPE_ENTRY:
                return onNode(new ClassDeclaration.TypeParent(type), raw);
            default:
                throw new IllegalStateException("Unexpected super type entry " + raw);
        }
    }

    protected ClassDeclaration.ClassBody convertClassBody(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        c.expect(TokenType.LBRACE);
        List<ClassDeclaration.EnumEntry> entries = new ArrayList<ClassDeclaration.EnumEntry>();
        while (c.at(SyntaxKind.ENUM_ENTRY) || c.at(TokenType.COMMA)) {
            SyntaxNode child = c.next();
            if (child.is(SyntaxKind.ENUM_ENTRY)) {
                entries.add(convertEnumEntry(child));
            }
        }
        List<Declaration> declarations = new ArrayList<Declaration>();
        while (!c.at(TokenType.RBRACE)) {
            declarations.add(convertDeclaration(c.next()));
        }
        return onNode(new ClassDeclaration.ClassBody(entries, declarations), raw);
    }

    protected ClassDeclaration.EnumEntry convertEnumEntry(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        NameExpression name = convertName(c.expect(TokenType.IDENTIFIER));
        ValueArgs args = c.at(SyntaxKind.VALUE_ARGUMENT_LIST) ? convertValueArgs(c.next()) : null;
        ClassDeclaration.ClassBody body = c.at(SyntaxKind.CLASS_BODY) ? convertClassBody(c.next()) : null;
        return onNode(new ClassDeclaration.EnumEntry(modifiers, name, args, body), raw);
    }

    protected InitDeclaration convertInit(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        c.next(); // init
        return onNode(new InitDeclaration(modifiers, convertBlock(c.expect(SyntaxKind.BLOCK))), raw);
    }

    protected FunctionDeclaration convertFunction(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        Keyword funKeyword = convertKeyword(c.expect(TokenType.FUN_KEYWORD));
        TypeParams typeParams = c.at(SyntaxKind.TYPE_PARAMETER_LIST) ? convertTypeParams(c.next()) : null;
        TypeRef receiver = null;
        if (c.at(SyntaxKind.TYPE_REFERENCE)) {
            receiver = convertTypeRef(c.next());
            c.skip(TokenType.DOT);
        }
        NameExpression name = c.at(TokenType.IDENTIFIER) ? convertName(c.next()) : null;
        FunctionParams params = c.at(SyntaxKind.VALUE_PARAMETER_LIST) ? convertFunctionParams(c.next()) : null;
        TypeRef returnType = null;
        if (c.skip(TokenType.COLON)) {
            returnType = convertTypeRef(c.expect(SyntaxKind.TYPE_REFERENCE));
        }
        List<PostModifier> postModifiers = convertPostModifiers(c);
        Keyword equals = null;
        Expression body = null;
        if (c.at(TokenType.EQ)) {
            equals = convertKeyword(c.next());
            body = convertExpression(c.next());
        } else if (c.at(SyntaxKind.BLOCK)) {
            body = convertBlock(c.next());
        }
        return onNode(new FunctionDeclaration(modifiers, funKeyword, typeParams, receiver, name, params, returnType,
                postModifiers, equals, body), raw);
    }

    private List<PostModifier> convertPostModifiers(Cursor c) {
        List<PostModifier> result = new ArrayList<PostModifier>();
        while (true) {
            if (c.at(SyntaxKind.TYPE_CONSTRAINT_SET)) {
                result.add(convertTypeConstraintSet(c.next()));
            } else if (c.at(SyntaxKind.CONTRACT)) {
                result.add(convertContract(c.next()));
            } else {
                return result;
            }
        }
    }

    protected FunctionParams convertFunctionParams(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        c.expect(TokenType.LPAR);
        List<FunctionParam> params = new ArrayList<FunctionParam>();
        Keyword trailingComma = null;
        while (!c.at(TokenType.RPAR)) {
            params.add(convertFunctionParam(c.expect(SyntaxKind.VALUE_PARAMETER)));
            trailingComma = separator(c, TokenType.RPAR);
        }
        return onNode(new FunctionParams(params, trailingComma), raw);
    }

    protected FunctionParam convertFunctionParam(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        Keyword valOrVar = c.at(TokenType.VAL_KEYWORD) || c.at(TokenType.VAR_KEYWORD) ? convertKeyword(c.next()) : null;
        NameExpression name = convertName(c.expect(TokenType.IDENTIFIER));
        TypeRef typeRef = null;
        if (c.skip(TokenType.COLON)) {
            typeRef = convertTypeRef(c.expect(SyntaxKind.TYPE_REFERENCE));
        }
        Keyword equals = null;
        Expression defaultValue = null;
        if (c.at(TokenType.EQ)) {
            equals = convertKeyword(c.next());
            defaultValue = convertExpression(c.next());
        }
        return onNode(new FunctionParam(modifiers, valOrVar, name, typeRef, equals, defaultValue), raw);
    }

    protected PropertyDeclaration convertProperty(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        Keyword valOrVar = convertKeyword(c.next());
        TypeParams typeParams = c.at(SyntaxKind.TYPE_PARAMETER_LIST) ? convertTypeParams(c.next()) : null;
        TypeRef receiver = null;
        if (c.at(SyntaxKind.TYPE_REFERENCE)) {
            receiver = convertTypeRef(c.next());
            c.skip(TokenType.DOT);
        }
        Keyword lPar = null;
        Keyword trailingComma = null;
        Keyword rPar = null;
        List<Variable> variables = new ArrayList<Variable>();
        if (c.at(TokenType.LPAR)) {
            lPar = convertKeyword(c.next());
            while (!c.at(TokenType.RPAR)) {
                variables.add(convertVariable(c.expect(SyntaxKind.VARIABLE)));
                trailingComma = separator(c, TokenType.RPAR);
            }
            rPar = convertKeyword(c.next());
            if (variables.size() == 1) {
                throw unsupported("Single-variable destructuring declaration", raw);
            }
        } else {
            variables.add(convertVariable(c.expect(SyntaxKind.VARIABLE)));
        }
        TypeConstraintSet constraints = c.at(SyntaxKind.TYPE_CONSTRAINT_SET)
                ? convertTypeConstraintSet(c.next()) : null;
        Keyword equals = null;
        Expression initializer = null;
        PropertyDeclaration.PropertyDelegate delegate = null;
        if (c.at(TokenType.EQ)) {
            equals = convertKeyword(c.next());
            initializer = convertExpression(c.next());
        } else if (c.at(SyntaxKind.PROPERTY_DELEGATE)) {
            delegate = convertPropertyDelegate(c.next());
        }
        List<PropertyDeclaration.Accessor> accessors = new ArrayList<PropertyDeclaration.Accessor>();
        while (c.hasNext()) {
            SyntaxNode child = c.next();
            if (child.is(SyntaxKind.GETTER)) {
                accessors.add(convertGetter(child));
            } else {
                accessors.add(convertSetter(requireKind(child, SyntaxKind.SETTER)));
            }
        }
        return onNode(new PropertyDeclaration(modifiers, valOrVar, typeParams, receiver, lPar, variables,
                trailingComma, rPar, constraints, equals, initializer, delegate, accessors), raw);
    }

    protected PropertyDeclaration.PropertyDelegate convertPropertyDelegate(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword byKeyword = convertKeyword(c.next());
        return onNode(new PropertyDeclaration.PropertyDelegate(byKeyword, convertExpression(c.next())), raw);
    }

    protected PropertyDeclaration.Getter convertGetter(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        Keyword getKeyword = convertKeyword(c.next());
        c.skip(TokenType.LPAR);
        c.skip(TokenType.RPAR);
        TypeRef typeRef = null;
        if (c.skip(TokenType.COLON)) {
            typeRef = convertTypeRef(c.expect(SyntaxKind.TYPE_REFERENCE));
        }
        List<PostModifier> postModifiers = convertPostModifiers(c);
        Keyword equals = null;
        Expression body = null;
        if (c.at(TokenType.EQ)) {
            equals = convertKeyword(c.next());
            body = convertExpression(c.next());
        } else if (c.at(SyntaxKind.BLOCK)) {
            body = convertBlock(c.next());
        }
        return onNode(new PropertyDeclaration.Getter(modifiers, getKeyword, typeRef, postModifiers, equals, body), raw);
    }

    protected PropertyDeclaration.Setter convertSetter(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        Keyword setKeyword = convertKeyword(c.next());
        FunctionParams params = c.at(SyntaxKind.VALUE_PARAMETER_LIST) ? convertFunctionParams(c.next()) : null;
        List<PostModifier> postModifiers = convertPostModifiers(c);
        Keyword equals = null;
        Expression body = null;
        if (c.at(TokenType.EQ)) {
            equals = convertKeyword(c.next());
            body = convertExpression(c.next());
        } else if (c.at(SyntaxKind.BLOCK)) {
            body = convertBlock(c.next());
        }
        return onNode(new PropertyDeclaration.Setter(modifiers, setKeyword, params, postModifiers, equals, body), raw);
    }

    protected Variable convertVariable(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        NameExpression name = convertName(c.expect(TokenType.IDENTIFIER));
        TypeRef typeRef = null;
        if (c.skip(TokenType.COLON)) {
            typeRef = convertTypeRef(c.expect(SyntaxKind.TYPE_REFERENCE));
        }
        return onNode(new Variable(modifiers, name, typeRef), raw);
    }

    protected TypeAliasDeclaration convertTypeAlias(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        c.expect(TokenType.TYPEALIAS_KEYWORD);
        NameExpression name = convertName(c.expect(TokenType.IDENTIFIER));
        TypeParams typeParams = c.at(SyntaxKind.TYPE_PARAMETER_LIST) ? convertTypeParams(c.next()) : null;
        c.expect(TokenType.EQ);
        TypeRef typeRef = convertTypeRef(c.expect(SyntaxKind.TYPE_REFERENCE));
        return onNode(new TypeAliasDeclaration(modifiers, name, typeParams, typeRef), raw);
    }

    protected SecondaryConstructorDeclaration convertSecondaryConstructor(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Modifiers modifiers = optionalModifiers(c);
        Keyword constructorKeyword = convertKeyword(c.next());
        FunctionParams params = convertFunctionParams(c.expect(SyntaxKind.VALUE_PARAMETER_LIST));
        SecondaryConstructorDeclaration.DelegationCall delegationCall = null;
        if (c.skip(TokenType.COLON)) {
            SyntaxNode call = c.expect(SyntaxKind.CONSTRUCTOR_DELEGATION_CALL);
            Cursor cc = new Cursor(call);
            Keyword target = convertKeyword(cc.next());
            delegationCall = onNode(new SecondaryConstructorDeclaration.DelegationCall(target,
                    convertValueArgs(cc.expect(SyntaxKind.VALUE_ARGUMENT_LIST))), call);
        }
        BlockExpression block = c.at(SyntaxKind.BLOCK) ? convertBlock(c.next()) : null;
        return onNode(new SecondaryConstructorDeclaration(modifiers, constructorKeyword, params, delegationCall,
                block), raw);
    }

    protected TypeParams convertTypeParams(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        c.expect(TokenType.LT);
        List<TypeParam> params = new ArrayList<TypeParam>();
        Keyword trailingComma = null;
        while (!c.at(TokenType.GT)) {
            SyntaxNode param = c.expect(SyntaxKind.TYPE_PARAMETER);
            Cursor pc = new Cursor(param);
            Modifiers modifiers = optionalModifiers(pc);
            NameExpression name = convertName(pc.expect(TokenType.IDENTIFIER));
            TypeRef bound = null;
            if (pc.skip(TokenType.COLON)) {
                bound = convertTypeRef(pc.expect(SyntaxKind.TYPE_REFERENCE));
            }
            params.add(onNode(new TypeParam(modifiers, name, bound), param));
            trailingComma = separator(c, TokenType.GT);
        }
        return onNode(new TypeParams(params, trailingComma), raw);
    }

    // ============ 修饰符 ============

    private Modifiers optionalModifiers(Cursor c) {
        return c.at(SyntaxKind.MODIFIER_LIST) ? convertModifiers(c.next()) : null;
    }

    protected Modifiers convertModifiers(SyntaxNode raw) {
        List<Modifier> elements = new ArrayList<Modifier>();
        for (SyntaxNode child : new Cursor(raw).rest()) {
            if (child.is(SyntaxKind.ANNOTATION_SET)) {
                elements.add(convertAnnotationSet(child));
            } else if (child.is(SyntaxKind.CONTEXT_RECEIVER_LIST)) {
                throw unsupported("Context receivers", child);
            } else {
                elements.add(convertKeyword(child));
            }
        }
        return onNode(new Modifiers(elements), raw);
    }

    protected AnnotationSet convertAnnotationSet(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword at = convertKeyword(c.expect(TokenType.AT));
        Keyword target = null;
        Keyword colon = null;
        if (c.at(TokenType.IDENTIFIER) && c.peek(1) != null && c.peek(1).is(TokenType.COLON)) {
            SyntaxNode targetRaw = c.next();
            Keyword.Type type = KEYWORDS_BY_TEXT.get(targetRaw.getText());
            if (type == null || !type.hasRole(Keyword.Role.ANNOTATION_TARGET)) {
                throw unsupported("Annotation use-site target '" + targetRaw.getText() + "'", targetRaw);
            }
            target = onNode(new Keyword(type), targetRaw);
            colon = convertKeyword(c.next());
        }
        Keyword lBracket = c.at(TokenType.LBRACKET) ? convertKeyword(c.next()) : null;
        List<Annotation> annotations = new ArrayList<Annotation>();
        while (c.at(SyntaxKind.ANNOTATION)) {
            annotations.add(convertAnnotation(c.next()));
        }
        Keyword rBracket = c.at(TokenType.RBRACKET) ? convertKeyword(c.next()) : null;
        return onNode(new AnnotationSet(at, target, colon, lBracket, annotations, rBracket), raw);
    }

    protected Annotation convertAnnotation(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        SimpleType type = convertSimpleType(c.expect(SyntaxKind.USER_TYPE));
        ValueArgs args = c.at(SyntaxKind.VALUE_ARGUMENT_LIST) ? convertValueArgs(c.next()) : null;
        return onNode(new Annotation(type, args), raw);
    }

    protected TypeConstraintSet convertTypeConstraintSet(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword where = convertKeyword(c.next());
        SyntaxNode constraintsRaw = c.expect(SyntaxKind.TYPE_CONSTRAINTS);
        List<TypeConstraintSet.TypeConstraint> constraints = new ArrayList<TypeConstraintSet.TypeConstraint>();
        for (SyntaxNode child : new Cursor(constraintsRaw).rest()) {
            if (child.is(TokenType.COMMA)) continue;
            Cursor cc = new Cursor(child);
            List<AnnotationSet> annotationSets = new ArrayList<AnnotationSet>();
            while (cc.at(SyntaxKind.ANNOTATION_SET)) {
                annotationSets.add(convertAnnotationSet(cc.next()));
            }
            NameExpression name = convertName(cc.expect(TokenType.IDENTIFIER));
            cc.expect(TokenType.COLON);
            TypeRef typeRef = convertTypeRef(cc.expect(SyntaxKind.TYPE_REFERENCE));
            constraints.add(onNode(new TypeConstraintSet.TypeConstraint(annotationSets, name, typeRef), child));
        }
        TypeConstraintSet.TypeConstraints list = onNode(new TypeConstraintSet.TypeConstraints(constraints),
                constraintsRaw);
        return onNode(new TypeConstraintSet(where, list), raw);
    }

    protected Contract convertContract(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword contractKeyword = convertKeyword(c.next());
        SyntaxNode effectsRaw = c.expect(SyntaxKind.CONTRACT_EFFECTS);
        Cursor ec = new Cursor(effectsRaw);
        ec.expect(TokenType.LBRACKET);
        List<Contract.ContractEffect> effects = new ArrayList<Contract.ContractEffect>();
        Keyword trailingComma = null;
        while (!ec.at(TokenType.RBRACKET)) {
            SyntaxNode effect = ec.expect(SyntaxKind.CONTRACT_EFFECT);
            effects.add(onNode(new Contract.ContractEffect(convertExpression(new Cursor(effect).next())), effect));
            trailingComma = separator(ec, TokenType.RBRACKET);
        }
        Contract.ContractEffects list = onNode(new Contract.ContractEffects(effects, trailingComma), effectsRaw);
        return onNode(new Contract(contractKeyword, list), raw);
    }

    // ============ 类型 ============

    protected TypeRef convertTypeRef(SyntaxNode raw) {
        requireKind(raw, SyntaxKind.TYPE_REFERENCE);
        Cursor c = new Cursor(raw);
        Keyword lPar = c.at(TokenType.LPAR) ? convertKeyword(c.next()) : null;
        Modifiers modifiers = optionalModifiers(c);
        Type type = convertType(c.next());
        Keyword rPar = c.at(TokenType.RPAR) ? convertKeyword(c.next()) : null;
        return onNode(new TypeRef(lPar, modifiers, type, rPar), raw);
    }

    protected Type convertType(SyntaxNode raw) {
        if (!raw.isLeaf()) {
            switch (raw.getKind()) {
                case USER_TYPE:
                    return convertSimpleType(raw);
                case NULLABLE_TYPE:
                    return convertNullableType(raw);
                case FUNCTION_TYPE:
                    return convertFunctionType(raw);
                case DYNAMIC_TYPE:
                    return onNode(new DynamicType(), raw);
                case TYPE_REFERENCE:
                    throw unsupported("Nested parenthesized type", raw);
                case DEFINITELY_NON_NULLABLE_TYPE:
                    throw unsupported("Definitely non-nullable type", raw);
                default:
                    break;
            }
        }
        throw new IllegalStateException("Unexpected type " + raw);
    }

    protected SimpleType convertSimpleType(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        List<SimpleType.Qualifier> qualifiers = new ArrayList<SimpleType.Qualifier>();
        while (c.at(SyntaxKind.TYPE_QUALIFIER)) {
            SyntaxNode qualifier = c.next();
            Cursor qc = new Cursor(qualifier);
            NameExpression name = convertName(qc.expect(TokenType.IDENTIFIER));
            TypeArgs typeArgs = qc.at(SyntaxKind.TYPE_ARGUMENT_LIST) ? convertTypeArgs(qc.next()) : null;
            qualifiers.add(onNode(new SimpleType.Qualifier(name, typeArgs), qualifier));
            c.skip(TokenType.DOT);
        }
        NameExpression name = convertName(c.expect(TokenType.IDENTIFIER));
        TypeArgs typeArgs = c.at(SyntaxKind.TYPE_ARGUMENT_LIST) ? convertTypeArgs(c.next()) : null;
        return onNode(new SimpleType(qualifiers, name, typeArgs), raw);
    }

    protected NullableType convertNullableType(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword lPar = c.at(TokenType.LPAR) ? convertKeyword(c.next()) : null;
        Modifiers modifiers = optionalModifiers(c);
        Type inner = convertType(c.next());
        Keyword rPar = c.at(TokenType.RPAR) ? convertKeyword(c.next()) : null;
        return onNode(new NullableType(lPar, modifiers, inner, rPar), raw);
    }

    protected FunctionType convertFunctionType(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        FunctionType.Receiver receiver = null;
        if (c.at(SyntaxKind.FUNCTION_TYPE_RECEIVER)) {
            SyntaxNode receiverRaw = c.next();
            receiver = onNode(new FunctionType.Receiver(
                    convertTypeRef(new Cursor(receiverRaw).expect(SyntaxKind.TYPE_REFERENCE))), receiverRaw);
            c.skip(TokenType.DOT);
        }
        SyntaxNode paramsRaw = c.expect(SyntaxKind.FUNCTION_TYPE_PARAMS);
        Cursor pc = new Cursor(paramsRaw);
        pc.expect(TokenType.LPAR);
        List<FunctionType.Param> params = new ArrayList<FunctionType.Param>();
        Keyword trailingComma = null;
        while (!pc.at(TokenType.RPAR)) {
            SyntaxNode param = pc.expect(SyntaxKind.FUNCTION_TYPE_PARAM);
            Cursor ppc = new Cursor(param);
            NameExpression name = null;
            if (ppc.at(TokenType.IDENTIFIER)) {
                name = convertName(ppc.next());
                ppc.expect(TokenType.COLON);
            }
            params.add(onNode(new FunctionType.Param(name, convertTypeRef(ppc.expect(SyntaxKind.TYPE_REFERENCE))),
                    param));
            trailingComma = separator(pc, TokenType.RPAR);
        }
        FunctionType.Params paramList = onNode(new FunctionType.Params(params, trailingComma), paramsRaw);
        c.expect(TokenType.ARROW);
        TypeRef returnType = convertTypeRef(c.expect(SyntaxKind.TYPE_REFERENCE));
        return onNode(new FunctionType(receiver, paramList, returnType), raw);
    }

    protected TypeArgs convertTypeArgs(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        c.expect(TokenType.LT);
        List<TypeArg> args = new ArrayList<TypeArg>();
        Keyword trailingComma = null;
        while (!c.at(TokenType.GT)) {
            SyntaxNode arg = c.expect(SyntaxKind.TYPE_ARGUMENT);
            Cursor ac = new Cursor(arg);
            if (ac.at(TokenType.MUL)) {
                args.add(onNode(new TypeArg(null, convertKeyword(ac.next()), null), arg));
            } else {
                Modifiers modifiers = optionalModifiers(ac);
                args.add(onNode(new TypeArg(modifiers, null, convertTypeRef(ac.expect(SyntaxKind.TYPE_REFERENCE))),
                        arg));
            }
            trailingComma = separator(c, TokenType.GT);
        }
        return onNode(new TypeArgs(args, trailingComma), raw);
    }

    // ============ 表达式 ============

    protected Expression convertExpression(SyntaxNode raw) {
        if (raw.isLeaf()) {
            return convertLeafExpression(raw);
        }
        switch (raw.getKind()) {
            case BINARY_EXPRESSION:
                return convertBinary(raw);
            case BINARY_WITH_TYPE: {
                Cursor c = new Cursor(raw);
                Expression lhs = convertExpression(c.next());
                Keyword operator = convertKeyword(c.next());
                return onNode(new BinaryTypeExpression(lhs, operator, convertTypeRef(c.next())), raw);
            }
            case PREFIX_EXPRESSION: {
                Cursor c = new Cursor(raw);
                Keyword operator = convertKeyword(c.next());
                return onNode(new PrefixUnaryExpression(operator, convertExpression(c.next())), raw);
            }
            case POSTFIX_EXPRESSION: {
                Cursor c = new Cursor(raw);
                Expression expression = convertExpression(c.next());
                return onNode(new PostfixUnaryExpression(expression, convertKeyword(c.next())), raw);
            }
            case ANNOTATED_EXPRESSION: {
                Cursor c = new Cursor(raw);
                List<AnnotationSet> annotationSets = new ArrayList<AnnotationSet>();
                while (c.at(SyntaxKind.ANNOTATION_SET)) {
                    annotationSets.add(convertAnnotationSet(c.next()));
                }
                return onNode(new AnnotatedExpression(annotationSets, convertExpression(c.next())), raw);
            }
            case LABELED_EXPRESSION: {
                Cursor c = new Cursor(raw);
                String label = c.expect(TokenType.IDENTIFIER).getText();
                c.expect(TokenType.AT);
                return onNode(new LabeledExpression(label, convertExpression(c.next())), raw);
            }
            case PARENTHESIZED: {
                Cursor c = new Cursor(raw);
                c.expect(TokenType.LPAR);
                return onNode(new ParenthesizedExpression(convertExpression(c.next())), raw);
            }
            case CALL_EXPRESSION:
                return convertCall(raw);
            case ARRAY_ACCESS_EXPRESSION:
                return convertArrayAccess(raw);
            case CALLABLE_REFERENCE: {
                Cursor c = new Cursor(raw);
                Expression receiver = c.at(TokenType.COLONCOLON) ? null : convertExpression(c.next());
                c.expect(TokenType.COLONCOLON);
                return onNode(new CallableReferenceExpression(receiver,
                        convertName(c.expect(TokenType.IDENTIFIER))), raw);
            }
            case CLASS_LITERAL: {
                Cursor c = new Cursor(raw);
                return onNode(new ClassLiteralExpression(convertExpression(c.next())), raw);
            }
            case STRING_TEMPLATE:
                return convertStringTemplate(raw);
            case THIS_EXPRESSION:
                return onNode(new ThisExpression(label(new Cursor(raw), 1)), raw);
            case SUPER_EXPRESSION:
                return convertSuper(raw);
            case IF:
                return convertIf(raw);
            case WHEN:
                return convertWhen(raw);
            case TRY:
                return convertTry(raw);
            case FOR:
                return convertFor(raw);
            case WHILE: {
                Cursor c = new Cursor(raw);
                Keyword whileKeyword = convertKeyword(c.next());
                Keyword lPar = convertKeyword(c.expect(TokenType.LPAR));
                Expression condition = convertExpression(c.next());
                Keyword rPar = convertKeyword(c.expect(TokenType.RPAR));
                return onNode(new WhileExpression(whileKeyword, lPar, condition, rPar, convertBody(c.next())), raw);
            }
            case DO_WHILE: {
                Cursor c = new Cursor(raw);
                Keyword doKeyword = convertKeyword(c.next());
                Expression body = convertBody(c.next());
                Keyword whileKeyword = convertKeyword(c.expect(TokenType.WHILE_KEYWORD));
                Keyword lPar = convertKeyword(c.expect(TokenType.LPAR));
                Expression condition = convertExpression(c.next());
                Keyword rPar = convertKeyword(c.expect(TokenType.RPAR));
                return onNode(new DoWhileExpression(doKeyword, body, whileKeyword, lPar, condition, rPar), raw);
            }
            case BLOCK:
                return convertBlock(raw);
            case LAMBDA_EXPRESSION:
                return convertLambda(raw);
            case OBJECT_LITERAL:
                return onNode(new ObjectLiteralExpression(convertClass(new Cursor(raw).expect(SyntaxKind.CLASS))), raw);
            case ANONYMOUS_FUNCTION:
                return onNode(new AnonymousFunctionExpression(convertFunction(new Cursor(raw).expect(SyntaxKind.FUN))),
                        raw);
            case THROW: {
                Cursor c = new Cursor(raw);
                c.expect(TokenType.THROW_KEYWORD);
                return onNode(new ThrowExpression(convertExpression(c.next())), raw);
            }
            case RETURN: {
                Cursor c = new Cursor(raw);
                String label = label(c, 1);
                Expression expression = c.hasNext() ? convertExpression(c.next()) : null;
                return onNode(new ReturnExpression(label, expression), raw);
            }
            case BREAK:
                return onNode(new BreakExpression(label(new Cursor(raw), 1)), raw);
            case CONTINUE:
                return onNode(new ContinueExpression(label(new Cursor(raw), 1)), raw);
            case COLLECTION_LITERAL: {
                Cursor c = new Cursor(raw);
                c.expect(TokenType.LBRACKET);
                List<Expression> expressions = new ArrayList<Expression>();
                Keyword trailingComma = null;
                while (!c.at(TokenType.RBRACKET)) {
                    expressions.add(convertExpression(c.next()));
                    trailingComma = separator(c, TokenType.RBRACKET);
                }
                return onNode(new CollectionLiteralExpression(expressions, trailingComma), raw);
            }
            default:
                throw new IllegalStateException("Unexpected expression " + raw);
        }
    }

    private Expression convertLeafExpression(SyntaxNode raw) {
        String text = raw.getText();
        switch (raw.getTokenType()) {
            case IDENTIFIER:
                return convertName(raw);
            case INTEGER_LITERAL:
                return onNode(new ConstantLiteralExpression(text, ConstantLiteralExpression.Kind.INTEGER), raw);
            case FLOAT_LITERAL:
                return onNode(new ConstantLiteralExpression(text, ConstantLiteralExpression.Kind.REAL), raw);
            case CHARACTER_LITERAL:
                return onNode(new ConstantLiteralExpression(text, ConstantLiteralExpression.Kind.CHARACTER), raw);
            case TRUE_KEYWORD:
            case FALSE_KEYWORD:
                return onNode(new ConstantLiteralExpression(text, ConstantLiteralExpression.Kind.BOOLEAN), raw);
            case NULL_KEYWORD:
                return onNode(new ConstantLiteralExpression(text, ConstantLiteralExpression.Kind.NULL), raw);
            default:
                throw new IllegalStateException("Unexpected expression " + raw);
        }
    }

    private Expression convertBinary(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Expression lhs = convertExpression(c.next());
        SyntaxNode operator = c.next();
        if (operator.is(TokenType.IDENTIFIER)) {
            NameExpression name = convertName(operator);
            return onNode(new BinaryInfixExpression(lhs, name, convertExpression(c.next())), raw);
        }
        Keyword keyword = convertKeyword(operator);
        return onNode(new BinaryExpression(lhs, keyword, convertExpression(c.next())), raw);
    }

    private Expression convertCall(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Expression callee = convertExpression(c.next());
        TypeArgs typeArgs = c.at(SyntaxKind.TYPE_ARGUMENT_LIST) ? convertTypeArgs(c.next()) : null;
        ValueArgs args = c.at(SyntaxKind.VALUE_ARGUMENT_LIST) ? convertValueArgs(c.next()) : null;
        CallExpression.LambdaArg lambdaArg = null;
        if (c.at(SyntaxKind.LAMBDA_ARGUMENT)) {
            SyntaxNode argRaw = c.next();
            Cursor ac = new Cursor(argRaw);
            List<AnnotationSet> annotationSets = new ArrayList<AnnotationSet>();
            while (ac.at(SyntaxKind.ANNOTATION_SET)) {
                annotationSets.add(convertAnnotationSet(ac.next()));
            }
            String label = null;
            if (ac.at(TokenType.IDENTIFIER)) {
                label = ac.next().getText();
                ac.expect(TokenType.AT);
            }
            LambdaExpression lambda = convertLambda(ac.expect(SyntaxKind.LAMBDA_EXPRESSION));
            lambdaArg = onNode(new CallExpression.LambdaArg(annotationSets, label, lambda), argRaw);
        }
        return onNode(new CallExpression(callee, typeArgs, args, lambdaArg), raw);
    }

    protected ValueArgs convertValueArgs(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        c.expect(TokenType.LPAR);
        List<ValueArg> args = new ArrayList<ValueArg>();
        Keyword trailingComma = null;
        while (!c.at(TokenType.RPAR)) {
            SyntaxNode arg = c.expect(SyntaxKind.VALUE_ARGUMENT);
            Cursor ac = new Cursor(arg);
            NameExpression name = null;
            if (ac.at(TokenType.IDENTIFIER) && ac.peek(1) != null && ac.peek(1).is(TokenType.EQ)) {
                name = convertName(ac.next());
                ac.next();
            }
            Keyword asterisk = ac.at(TokenType.MUL) ? convertKeyword(ac.next()) : null;
            args.add(onNode(new ValueArg(name, asterisk, convertExpression(ac.next())), arg));
            trailingComma = separator(c, TokenType.RPAR);
        }
        return onNode(new ValueArgs(args, trailingComma), raw);
    }

    private Expression convertArrayAccess(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Expression expression = convertExpression(c.next());
        c.expect(TokenType.LBRACKET);
        List<Expression> indices = new ArrayList<Expression>();
        Keyword trailingComma = null;
        while (!c.at(TokenType.RBRACKET)) {
            indices.add(convertExpression(c.next()));
            trailingComma = separator(c, TokenType.RBRACKET);
        }
        return onNode(new ArrayAccessExpression(expression, indices, trailingComma), raw);
    }

    private Expression convertStringTemplate(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        boolean multiline = c.expect(TokenType.OPEN_QUOTE).getText().length() == 3;
        List<StringLiteralExpression.StringEntry> entries = new ArrayList<StringLiteralExpression.StringEntry>();
        while (!c.at(TokenType.CLOSING_QUOTE)) {
            SyntaxNode part = c.next();
            if (part.is(TokenType.REGULAR_STRING_PART)) {
                entries.add(onNode(new StringLiteralExpression.LiteralStringEntry(part.getText()), part));
            } else if (part.is(TokenType.ESCAPE_SEQUENCE)) {
                entries.add(onNode(new StringLiteralExpression.EscapeStringEntry(part.getText()), part));
            } else if (part.is(SyntaxKind.SHORT_TEMPLATE_ENTRY) || part.is(SyntaxKind.LONG_TEMPLATE_ENTRY)) {
                Cursor pc = new Cursor(part);
                pc.next(); // '$' 或 '${'
                Expression expression = convertExpression(pc.next());
                entries.add(onNode(new StringLiteralExpression.TemplateStringEntry(expression,
                        part.is(SyntaxKind.SHORT_TEMPLATE_ENTRY)), part));
            } else {
                throw new IllegalStateException("Unexpected string part " + part);
            }
        }
        return onNode(new StringLiteralExpression(entries, multiline), raw);
    }

    private Expression convertSuper(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        c.expect(TokenType.SUPER_KEYWORD);
        TypeRef typeArgType = null;
        if (c.skip(TokenType.LT)) {
            typeArgType = convertTypeRef(c.expect(SyntaxKind.TYPE_REFERENCE));
            c.expect(TokenType.GT);
        }
        return onNode(new SuperExpression(typeArgType, label(c, 0)), raw);
    }

    private Expression convertIf(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword ifKeyword = convertKeyword(c.next());
        Keyword lPar = convertKeyword(c.expect(TokenType.LPAR));
        Expression condition = convertExpression(c.next());
        Keyword rPar = convertKeyword(c.expect(TokenType.RPAR));
        Expression body = convertBody(c.next());
        Keyword elseKeyword = null;
        Expression elseBody = null;
        if (c.at(TokenType.ELSE_KEYWORD)) {
            elseKeyword = convertKeyword(c.next());
            elseBody = convertBody(c.next());
        }
        return onNode(new IfExpression(ifKeyword, lPar, condition, rPar, body, elseKeyword, elseBody), raw);
    }

    private Expression convertWhen(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword whenKeyword = convertKeyword(c.next());
        Keyword lPar = null;
        Expression subject = null;
        Keyword rPar = null;
        if (c.at(TokenType.LPAR)) {
            lPar = convertKeyword(c.next());
            SyntaxNode subjectRaw = c.next();
            if (isDeclaration(subjectRaw)) {
                throw unsupported("Variable declaration in when subject", subjectRaw);
            }
            subject = convertExpression(subjectRaw);
            rPar = convertKeyword(c.expect(TokenType.RPAR));
        }
        c.expect(TokenType.LBRACE);
        List<WhenExpression.WhenBranch> branches = new ArrayList<WhenExpression.WhenBranch>();
        while (c.at(SyntaxKind.WHEN_ENTRY)) {
            branches.add(convertWhenBranch(c.next()));
        }
        return onNode(new WhenExpression(whenKeyword, lPar, subject, rPar, branches), raw);
    }

    private WhenExpression.WhenBranch convertWhenBranch(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        List<WhenExpression.WhenCondition> conditions = new ArrayList<WhenExpression.WhenCondition>();
        Keyword trailingComma = null;
        Keyword elseKeyword = null;
        if (c.at(TokenType.ELSE_KEYWORD)) {
            elseKeyword = convertKeyword(c.next());
        } else {
            while (!c.at(TokenType.ARROW)) {
                conditions.add(convertWhenCondition(c.expect(SyntaxKind.WHEN_CONDITION)));
                trailingComma = separator(c, TokenType.ARROW);
            }
        }
        Keyword arrow = convertKeyword(c.expect(TokenType.ARROW));
        Expression body = convertBody(c.next());
        return onNode(new WhenExpression.WhenBranch(conditions, trailingComma, elseKeyword, arrow, body), raw);
    }

    private WhenExpression.WhenCondition convertWhenCondition(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        SyntaxNode first = c.next();
        if (first.is(TokenType.IN_KEYWORD) || first.is(TokenType.NOT_IN)) {
            return onNode(new WhenExpression.WhenCondition(convertKeyword(first), convertExpression(c.next()), null),
                    raw);
        }
        if (first.is(TokenType.IS_KEYWORD) || first.is(TokenType.NOT_IS)) {
            return onNode(new WhenExpression.WhenCondition(convertKeyword(first), null, convertTypeRef(c.next())),
                    raw);
        }
        return onNode(new WhenExpression.WhenCondition(null, convertExpression(first), null), raw);
    }

    private Expression convertTry(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        c.expect(TokenType.TRY_KEYWORD);
        BlockExpression block = convertBlock(c.expect(SyntaxKind.BLOCK));
        List<TryExpression.CatchClause> catchClauses = new ArrayList<TryExpression.CatchClause>();
        while (c.at(SyntaxKind.CATCH)) {
            SyntaxNode clause = c.next();
            Cursor cc = new Cursor(clause);
            Keyword catchKeyword = convertKeyword(cc.next());
            FunctionParams params = convertFunctionParams(cc.expect(SyntaxKind.VALUE_PARAMETER_LIST));
            catchClauses.add(onNode(new TryExpression.CatchClause(catchKeyword, params,
                    convertBlock(cc.expect(SyntaxKind.BLOCK))), clause));
        }
        BlockExpression finallyBlock = null;
        if (c.atSoft("finally")) {
            c.next();
            finallyBlock = convertBlock(c.expect(SyntaxKind.BLOCK));
        }
        return onNode(new TryExpression(block, catchClauses, finallyBlock), raw);
    }

    private Expression convertFor(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        Keyword forKeyword = convertKeyword(c.next());
        Keyword lPar = convertKeyword(c.expect(TokenType.LPAR));
        LambdaExpression.LambdaParam loopParam = convertLambdaParam(c.expect(SyntaxKind.LAMBDA_PARAMETER));
        Keyword inKeyword = convertKeyword(c.expect(TokenType.IN_KEYWORD));
        Expression range = convertExpression(c.next());
        Keyword rPar = convertKeyword(c.expect(TokenType.RPAR));
        return onNode(new ForExpression(forKeyword, lPar, loopParam, inKeyword, range, rPar, convertBody(c.next())),
                raw);
    }

    /**
     * 控制结构的分支体：代码块或单个表达式
     */
    private Expression convertBody(SyntaxNode raw) {
        return raw.is(SyntaxKind.BLOCK) ? convertBlock(raw) : convertExpression(raw);
    }

    protected BlockExpression convertBlock(SyntaxNode raw) {
        requireKind(raw, SyntaxKind.BLOCK);
        return onNode(new BlockExpression(convertStatements(raw, TokenType.LBRACE, TokenType.RBRACE)), raw);
    }

    private List<Statement> convertStatements(SyntaxNode raw, TokenType open, TokenType close) {
        List<Statement> statements = new ArrayList<Statement>();
        for (SyntaxNode child : new Cursor(raw).rest()) {
            if (child.is(open) || child.is(close)) continue;
            statements.add(convertStatement(child));
        }
        return statements;
    }

    protected LambdaExpression convertLambda(SyntaxNode raw) {
        requireKind(raw, SyntaxKind.LAMBDA_EXPRESSION);
        Cursor c = new Cursor(raw);
        c.expect(TokenType.LBRACE);
        LambdaExpression.LambdaParams params = null;
        if (c.at(SyntaxKind.LAMBDA_PARAMETER_LIST)) {
            SyntaxNode paramsRaw = c.next();
            Cursor pc = new Cursor(paramsRaw);
            List<LambdaExpression.LambdaParam> elements = new ArrayList<LambdaExpression.LambdaParam>();
            Keyword trailingComma = null;
            while (pc.hasNext()) {
                elements.add(convertLambdaParam(pc.expect(SyntaxKind.LAMBDA_PARAMETER)));
                trailingComma = separator(pc, null);
            }
            params = onNode(new LambdaExpression.LambdaParams(elements, trailingComma), paramsRaw);
        }
        Keyword arrow = c.at(TokenType.ARROW) ? convertKeyword(c.next()) : null;
        SyntaxNode bodyRaw = c.expect(SyntaxKind.LAMBDA_BODY);
        LambdaExpression.LambdaBody body = onNode(new LambdaExpression.LambdaBody(
                convertStatements(bodyRaw, null, null)), bodyRaw);
        return onNode(new LambdaExpression(params, arrow, body), raw);
    }

    protected LambdaExpression.LambdaParam convertLambdaParam(SyntaxNode raw) {
        Cursor c = new Cursor(raw);
        if (!c.at(TokenType.LPAR)) {
            List<Variable> variables = Collections.singletonList(convertVariable(c.expect(SyntaxKind.VARIABLE)));
            return onNode(new LambdaExpression.LambdaParam(null, variables, null, null, null), raw);
        }
        Keyword lPar = convertKeyword(c.next());
        List<Variable> variables = new ArrayList<Variable>();
        Keyword trailingComma = null;
        while (!c.at(TokenType.RPAR)) {
            variables.add(convertVariable(c.expect(SyntaxKind.VARIABLE)));
            trailingComma = separator(c, TokenType.RPAR);
        }
        Keyword rPar = convertKeyword(c.next());
        if (variables.size() == 1) {
            throw unsupported("Single-variable destructuring parameter", raw);
        }
        TypeRef destructType = null;
        if (c.skip(TokenType.COLON)) {
            destructType = convertTypeRef(c.expect(SyntaxKind.TYPE_REFERENCE));
        }
        return onNode(new LambdaExpression.LambdaParam(lPar, variables, trailingComma, rPar, destructType), raw);
    }

    // ============ 叶子 ============

    protected NameExpression convertName(SyntaxNode raw) {
        if (!raw.is(TokenType.IDENTIFIER)) {
            throw new IllegalStateException("Expected a name but found " + raw);
        }
        return onNode(new NameExpression(raw.getText()), raw);
    }

    protected Keyword convertKeyword(SyntaxNode raw) {
        Keyword.Type type = raw.isLeaf() ? KEYWORDS_BY_TEXT.get(raw.getText()) : null;
        if (type == null) {
            throw new IllegalStateException("Expected a keyword but found " + raw);
        }
        return onNode(new Keyword(type), raw);
    }

    // ============ 辅助方法 ============

    /**
     * 列表元素之后的逗号；后面紧跟 closer（为 null 时表示列表结尾）的逗号是尾随逗号，作为关键词返回
     */
    private Keyword separator(Cursor c, TokenType closer) {
        if (!c.at(TokenType.COMMA)) return null;
        SyntaxNode comma = c.next();
        boolean trailing = closer == null ? !c.hasNext() : c.at(closer);
        return trailing ? convertKeyword(comma) : null;
    }

    /**
     * 跳过 offset 个单元后读取 '@标签'，没有时返回 null
     */
    private static String label(Cursor c, int offset) {
        for (int i = 0; i < offset; i++) {
            c.next();
        }
        if (c.at(TokenType.AT)) {
            c.next();
            return c.expect(TokenType.IDENTIFIER).getText();
        }
        return null;
    }

    private static SyntaxNode requireKind(SyntaxNode raw, SyntaxKind kind) {
        if (!raw.is(kind)) {
            throw new IllegalStateException("Expected " + kind + " but found " + raw);
        }
        return raw;
    }

    private static UnsupportedSyntaxException unsupported(String what, SyntaxNode raw) {
        return new UnsupportedSyntaxException(what + " is not supported", raw.getStartOffset());
    }

    /**
     * 有效子节点游标：跳过附加信息、分号、错误节点和文件结尾
     */
    private static final class Cursor {
        private final List<SyntaxNode> items = new ArrayList<SyntaxNode>();
        private int pos;

        Cursor(SyntaxNode raw) {
            for (SyntaxNode child : raw.getChildren()) {
                if (child.isTrivia() || child.is(SyntaxKind.ERROR_ELEMENT) || child.is(TokenType.EOF)) continue;
                items.add(child);
            }
        }

        boolean hasNext() {
            return pos < items.size();
        }

        SyntaxNode peek(int n) {
            return pos + n < items.size() ? items.get(pos + n) : null;
        }

        SyntaxNode next() {
            if (!hasNext()) {
                throw new IllegalStateException("Unexpected end of element");
            }
            return items.get(pos++);
        }

        List<SyntaxNode> rest() {
            List<SyntaxNode> result = new ArrayList<SyntaxNode>(items.subList(pos, items.size()));
            pos = items.size();
            return result;
        }

        boolean at(SyntaxKind kind) {
            return hasNext() && items.get(pos).is(kind);
        }

        boolean at(TokenType type) {
            return hasNext() && items.get(pos).is(type);
        }

        boolean atSoft(String word) {
            return at(TokenType.IDENTIFIER) && word.equals(items.get(pos).getText());
        }

        boolean skip(TokenType type) {
            if (at(type)) {
                pos++;
                return true;
            }
            return false;
        }

        SyntaxNode expect(SyntaxKind kind) {
            if (!at(kind)) {
                throw new IllegalStateException("Expected " + kind + " but found " + (hasNext() ? items.get(pos) : "end"));
            }
            return items.get(pos++);
        }

        SyntaxNode expect(TokenType type) {
            if (!at(type)) {
                throw new IllegalStateException("Expected " + type + " but found " + (hasNext() ? items.get(pos) : "end"));
            }
            return items.get(pos++);
        }
    }
}
