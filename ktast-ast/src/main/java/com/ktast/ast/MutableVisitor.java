package com.ktast.ast;

import com.ktast.ast.decl.*;
import com.ktast.ast.expr.*;
import com.ktast.ast.extra.*;
import com.ktast.ast.modifier.*;
import com.ktast.ast.type.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 可变访问者：深度优先遍历并自底向上重建语法树
 *
 * <p>每个节点先经过 preVisit，再重建子节点，最后经过 postVisit。子节点全部未变（引用相同）时复用原节点，
 * 因此未改动的子树保持原有身份，附加信息仍然有效；节点被替换时把原节点的附加信息迁移到新节点上。</p>
 *
 * <pre>
 * Node renamed = MutableVisitor.traverse(file, extrasMap, path -&gt; {
 *     Node node = path.getNode();
 *     if (node instanceof NameExpression &amp;&amp; "x".equals(((NameExpression) node).getText())) {
 *         return new NameExpression("a");
 *     }
 *     return node;
 * });
 * </pre>
 */
public class MutableVisitor implements NodeVisitor<Node, NodePath> {

    private final MutableExtrasMap extrasMap;
    private final NodeTransformer preVisit;
    private final NodeTransformer postVisit;

    protected MutableVisitor(MutableExtrasMap extrasMap, NodeTransformer preVisit, NodeTransformer postVisit) {
        this.extrasMap = extrasMap;
        this.preVisit = preVisit == null ? NodeTransformer.IDENTITY : preVisit;
        this.postVisit = postVisit == null ? NodeTransformer.IDENTITY : postVisit;
    }

    public static <T extends Node> T traverse(T root, NodeTransformer transform) {
        return traverse(root, null, transform, null);
    }

    public static <T extends Node> T traverse(T root, MutableExtrasMap extrasMap, NodeTransformer transform) {
        return traverse(root, extrasMap, transform, null);
    }

    /**
     * 遍历并重建语法树
     *
     * @param root      根节点
     * @param extrasMap 附加信息映射，可为 null；节点被替换时在其上迁移附加信息
     * @param preVisit  访问子节点之前调用，可为 null
     * @param postVisit 子节点重建之后调用，可为 null
     * @return 新的根节点，未发生变化时为原根节点
     */
    @SuppressWarnings("unchecked")
    public static <T extends Node> T traverse(T root, MutableExtrasMap extrasMap,
                                              NodeTransformer preVisit, NodeTransformer postVisit) {
        if (root == null) {
            throw new IllegalArgumentException("root is required");
        }
        MutableVisitor visitor = new MutableVisitor(extrasMap, preVisit, postVisit);
        return (T) visitor.visit(NodePath.rootPath(root));
    }

    /**
     * 处理一个节点：preVisit、重建子节点、postVisit，并在身份改变时迁移附加信息
     */
    protected Node visit(NodePath path) {
        Node original = path.getNode();
        Node pre = checkResult(preVisit.transform(path), path);
        NodePath prePath = pre == original ? path : replace(path, pre);
        Node rebuilt = pre.accept(this, prePath);
        NodePath postPath = rebuilt == pre ? prePath : replace(path, rebuilt);
        Node result = checkResult(postVisit.transform(postPath), path);
        if (result != original && extrasMap != null) {
            extrasMap.moveExtras(original, result);
        }
        return result;
    }

    private static NodePath replace(NodePath path, Node node) {
        return path.isRoot() ? NodePath.rootPath(node) : path.getParent().childPath(node);
    }

    private static Node checkResult(Node result, NodePath path) {
        if (result == null) {
            throw new IllegalStateException("Transform returned null for " + path);
        }
        return result;
    }

    private static IllegalStateException extraInTree(Extra extra) {
        return new IllegalStateException("Extra " + extra.getKindName() + " cannot appear inside a syntax tree");
    }

    /**
     * 单个节点的子节点重建器：记录是否有子节点被替换
     */
    private final class ChildRebuilder {
        private final NodePath parent;
        private boolean changed;

        ChildRebuilder(NodePath parent) {
            this.parent = parent;
        }

        <T> T rebuild(T child, Class<T> expected) {
            if (child == null) return null;
            Node original = (Node) child;
            Node result = visit(parent.childPath(original));
            if (!expected.isInstance(result)) {
                throw new IllegalStateException("Expected " + expected.getSimpleName() + " in "
                        + parent.getNode().getKindName() + ", got " + result.getKindName());
            }
            if (result != original) {
                changed = true;
            }
            return expected.cast(result);
        }

        <T> List<T> rebuildList(List<T> children, Class<T> expected) {
            List<T> result = new ArrayList<T>(children.size());
            for (T child : children) {
                result.add(rebuild(child, expected));
            }
            return result;
        }

        boolean isChanged() {
            return changed;
        }
    }

    // ============ 声明 ============

    @Override
    public Node visitClassDeclaration(ClassDeclaration node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Keyword declarationKeyword = r.rebuild(node.getDeclarationKeyword(), Keyword.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        TypeParams typeParams = r.rebuild(node.getTypeParams(), TypeParams.class);
        ClassDeclaration.PrimaryConstructor primaryConstructor =
                r.rebuild(node.getPrimaryConstructor(), ClassDeclaration.PrimaryConstructor.class);
        ClassDeclaration.ClassParents classParents =
                r.rebuild(node.getClassParents(), ClassDeclaration.ClassParents.class);
        TypeConstraintSet typeConstraintSet = r.rebuild(node.getTypeConstraintSet(), TypeConstraintSet.class);
        ClassDeclaration.ClassBody classBody = r.rebuild(node.getClassBody(), ClassDeclaration.ClassBody.class);
        if (!r.isChanged()) return node;
        return new ClassDeclaration(modifiers, declarationKeyword, name, typeParams, primaryConstructor,
                classParents, typeConstraintSet, classBody);
    }

    @Override
    public Node visitPrimaryConstructor(ClassDeclaration.PrimaryConstructor node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Keyword constructorKeyword = r.rebuild(node.getConstructorKeyword(), Keyword.class);
        FunctionParams params = r.rebuild(node.getParams(), FunctionParams.class);
        return r.isChanged() ? new ClassDeclaration.PrimaryConstructor(modifiers, constructorKeyword, params) : node;
    }

    @Override
    public Node visitClassParents(ClassDeclaration.ClassParents node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<ClassDeclaration.ClassParent> elements =
                r.rebuildList(node.getElements(), ClassDeclaration.ClassParent.class);
        return r.isChanged() ? new ClassDeclaration.ClassParents(elements) : node;
    }

    @Override
    public Node visitCallConstructorParent(ClassDeclaration.CallConstructorParent node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        TypeRef type = r.rebuild(node.getType(), TypeRef.class);
        ValueArgs args = r.rebuild(node.getArgs(), ValueArgs.class);
        return r.isChanged() ? new ClassDeclaration.CallConstructorParent(type, args) : node;
    }

    @Override
    public Node visitDelegationParent(ClassDeclaration.DelegationParent node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        TypeRef type = r.rebuild(node.getType(), TypeRef.class);
        Keyword byKeyword = r.rebuild(node.getByKeyword(), Keyword.class);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new ClassDeclaration.DelegationParent(type, byKeyword, expression) : node;
    }

    @Override
    public Node visitTypeParent(ClassDeclaration.TypeParent node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        TypeRef type = r.rebuild(node.getType(), TypeRef.class);
        return r.isChanged() ? new ClassDeclaration.TypeParent(type) : node;
    }

    @Override
    public Node visitClassBody(ClassDeclaration.ClassBody node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<ClassDeclaration.EnumEntry> enumEntries =
                r.rebuildList(node.getEnumEntries(), ClassDeclaration.EnumEntry.class);
        List<Declaration> declarations = r.rebuildList(node.getDeclarations(), Declaration.class);
        return r.isChanged() ? new ClassDeclaration.ClassBody(enumEntries, declarations) : node;
    }

    @Override
    public Node visitEnumEntry(ClassDeclaration.EnumEntry node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        ValueArgs args = r.rebuild(node.getArgs(), ValueArgs.class);
        ClassDeclaration.ClassBody classBody = r.rebuild(node.getClassBody(), ClassDeclaration.ClassBody.class);
        return r.isChanged() ? new ClassDeclaration.EnumEntry(modifiers, name, args, classBody) : node;
    }

    @Override
    public Node visitFunctionDeclaration(FunctionDeclaration node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Keyword funKeyword = r.rebuild(node.getFunKeyword(), Keyword.class);
        TypeParams typeParams = r.rebuild(node.getTypeParams(), TypeParams.class);
        TypeRef receiverTypeRef = r.rebuild(node.getReceiverTypeRef(), TypeRef.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        FunctionParams params = r.rebuild(node.getParams(), FunctionParams.class);
        TypeRef returnTypeRef = r.rebuild(node.getReturnTypeRef(), TypeRef.class);
        List<PostModifier> postModifiers = r.rebuildList(node.getPostModifiers(), PostModifier.class);
        Keyword equals = r.rebuild(node.getEquals(), Keyword.class);
        Expression body = r.rebuild(node.getBody(), Expression.class);
        if (!r.isChanged()) return node;
        return new FunctionDeclaration(modifiers, funKeyword, typeParams, receiverTypeRef, name, params,
                returnTypeRef, postModifiers, equals, body);
    }

    @Override
    public Node visitFunctionParam(FunctionParam node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Keyword valOrVarKeyword = r.rebuild(node.getValOrVarKeyword(), Keyword.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        Keyword equals = r.rebuild(node.getEquals(), Keyword.class);
        Expression defaultValue = r.rebuild(node.getDefaultValue(), Expression.class);
        if (!r.isChanged()) return node;
        return new FunctionParam(modifiers, valOrVarKeyword, name, typeRef, equals, defaultValue);
    }

    @Override
    public Node visitFunctionParams(FunctionParams node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<FunctionParam> elements = r.rebuildList(node.getElements(), FunctionParam.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        return r.isChanged() ? new FunctionParams(elements, trailingComma) : node;
    }

    @Override
    public Node visitImportDirective(ImportDirective node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword importKeyword = r.rebuild(node.getImportKeyword(), Keyword.class);
        List<NameExpression> names = r.rebuildList(node.getNames(), NameExpression.class);
        Keyword asterisk = r.rebuild(node.getAsterisk(), Keyword.class);
        ImportDirective.ImportAlias alias = r.rebuild(node.getAlias(), ImportDirective.ImportAlias.class);
        return r.isChanged() ? new ImportDirective(importKeyword, names, asterisk, alias) : node;
    }

    @Override
    public Node visitImportAlias(ImportDirective.ImportAlias node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword asKeyword = r.rebuild(node.getAsKeyword(), Keyword.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        return r.isChanged() ? new ImportDirective.ImportAlias(asKeyword, name) : node;
    }

    @Override
    public Node visitInitDeclaration(InitDeclaration node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        BlockExpression block = r.rebuild(node.getBlock(), BlockExpression.class);
        return r.isChanged() ? new InitDeclaration(modifiers, block) : node;
    }

    @Override
    public Node visitKotlinFile(KotlinFile node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<AnnotationSet> annotationSets = r.rebuildList(node.getAnnotationSets(), AnnotationSet.class);
        PackageDirective packageDirective = r.rebuild(node.getPackageDirective(), PackageDirective.class);
        List<ImportDirective> importDirectives = r.rebuildList(node.getImportDirectives(), ImportDirective.class);
        List<Declaration> declarations = r.rebuildList(node.getDeclarations(), Declaration.class);
        return r.isChanged() ? new KotlinFile(annotationSets, packageDirective, importDirectives, declarations) : node;
    }

    @Override
    public Node visitKotlinScript(KotlinScript node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<AnnotationSet> annotationSets = r.rebuildList(node.getAnnotationSets(), AnnotationSet.class);
        PackageDirective packageDirective = r.rebuild(node.getPackageDirective(), PackageDirective.class);
        List<ImportDirective> importDirectives = r.rebuildList(node.getImportDirectives(), ImportDirective.class);
        List<Statement> statements = r.rebuildList(node.getStatements(), Statement.class);
        return r.isChanged() ? new KotlinScript(annotationSets, packageDirective, importDirectives, statements) : node;
    }

    @Override
    public Node visitPackageDirective(PackageDirective node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword packageKeyword = r.rebuild(node.getPackageKeyword(), Keyword.class);
        List<NameExpression> names = r.rebuildList(node.getNames(), NameExpression.class);
        return r.isChanged() ? new PackageDirective(packageKeyword, names) : node;
    }

    @Override
    public Node visitPropertyDeclaration(PropertyDeclaration node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Keyword valOrVarKeyword = r.rebuild(node.getValOrVarKeyword(), Keyword.class);
        TypeParams typeParams = r.rebuild(node.getTypeParams(), TypeParams.class);
        TypeRef receiverTypeRef = r.rebuild(node.getReceiverTypeRef(), TypeRef.class);
        Keyword lPar = r.rebuild(node.getLPar(), Keyword.class);
        List<Variable> variables = r.rebuildList(node.getVariables(), Variable.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        Keyword rPar = r.rebuild(node.getRPar(), Keyword.class);
        TypeConstraintSet typeConstraintSet = r.rebuild(node.getTypeConstraintSet(), TypeConstraintSet.class);
        Keyword equals = r.rebuild(node.getEquals(), Keyword.class);
        Expression initializer = r.rebuild(node.getInitializer(), Expression.class);
        PropertyDeclaration.PropertyDelegate delegate =
                r.rebuild(node.getDelegate(), PropertyDeclaration.PropertyDelegate.class);
        List<PropertyDeclaration.Accessor> accessors =
                r.rebuildList(node.getAccessors(), PropertyDeclaration.Accessor.class);
        if (!r.isChanged()) return node;
        return new PropertyDeclaration(modifiers, valOrVarKeyword, typeParams, receiverTypeRef, lPar, variables,
                trailingComma, rPar, typeConstraintSet, equals, initializer, delegate, accessors);
    }

    @Override
    public Node visitPropertyDelegate(PropertyDeclaration.PropertyDelegate node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword byKeyword = r.rebuild(node.getByKeyword(), Keyword.class);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new PropertyDeclaration.PropertyDelegate(byKeyword, expression) : node;
    }

    @Override
    public Node visitGetter(PropertyDeclaration.Getter node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Keyword getKeyword = r.rebuild(node.getGetKeyword(), Keyword.class);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        List<PostModifier> postModifiers = r.rebuildList(node.getPostModifiers(), PostModifier.class);
        Keyword equals = r.rebuild(node.getEquals(), Keyword.class);
        Expression body = r.rebuild(node.getBody(), Expression.class);
        if (!r.isChanged()) return node;
        return new PropertyDeclaration.Getter(modifiers, getKeyword, typeRef, postModifiers, equals, body);
    }

    @Override
    public Node visitSetter(PropertyDeclaration.Setter node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Keyword setKeyword = r.rebuild(node.getSetKeyword(), Keyword.class);
        FunctionParams params = r.rebuild(node.getParams(), FunctionParams.class);
        List<PostModifier> postModifiers = r.rebuildList(node.getPostModifiers(), PostModifier.class);
        Keyword equals = r.rebuild(node.getEquals(), Keyword.class);
        Expression body = r.rebuild(node.getBody(), Expression.class);
        if (!r.isChanged()) return node;
        return new PropertyDeclaration.Setter(modifiers, setKeyword, params, postModifiers, equals, body);
    }

    @Override
    public Node visitSecondaryConstructorDeclaration(SecondaryConstructorDeclaration node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Keyword constructorKeyword = r.rebuild(node.getConstructorKeyword(), Keyword.class);
        FunctionParams params = r.rebuild(node.getParams(), FunctionParams.class);
        SecondaryConstructorDeclaration.DelegationCall delegationCall =
                r.rebuild(node.getDelegationCall(), SecondaryConstructorDeclaration.DelegationCall.class);
        BlockExpression block = r.rebuild(node.getBlock(), BlockExpression.class);
        if (!r.isChanged()) return node;
        return new SecondaryConstructorDeclaration(modifiers, constructorKeyword, params, delegationCall, block);
    }

    @Override
    public Node visitDelegationCall(SecondaryConstructorDeclaration.DelegationCall node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword target = r.rebuild(node.getTarget(), Keyword.class);
        ValueArgs args = r.rebuild(node.getArgs(), ValueArgs.class);
        return r.isChanged() ? new SecondaryConstructorDeclaration.DelegationCall(target, args) : node;
    }

    @Override
    public Node visitTypeAliasDeclaration(TypeAliasDeclaration node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        TypeParams typeParams = r.rebuild(node.getTypeParams(), TypeParams.class);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        return r.isChanged() ? new TypeAliasDeclaration(modifiers, name, typeParams, typeRef) : node;
    }

    @Override
    public Node visitTypeParam(TypeParam node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        return r.isChanged() ? new TypeParam(modifiers, name, typeRef) : node;
    }

    @Override
    public Node visitTypeParams(TypeParams node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<TypeParam> elements = r.rebuildList(node.getElements(), TypeParam.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        return r.isChanged() ? new TypeParams(elements, trailingComma) : node;
    }

    @Override
    public Node visitVariable(Variable node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        return r.isChanged() ? new Variable(modifiers, name, typeRef) : node;
    }


    // ============ 表达式 ============

    @Override
    public Node visitAnnotatedExpression(AnnotatedExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<AnnotationSet> annotationSets = r.rebuildList(node.getAnnotationSets(), AnnotationSet.class);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new AnnotatedExpression(annotationSets, expression) : node;
    }

    @Override
    public Node visitAnonymousFunctionExpression(AnonymousFunctionExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        FunctionDeclaration function = r.rebuild(node.getFunction(), FunctionDeclaration.class);
        return r.isChanged() ? new AnonymousFunctionExpression(function) : node;
    }

    @Override
    public Node visitArrayAccessExpression(ArrayAccessExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        List<Expression> indices = r.rebuildList(node.getIndices(), Expression.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        return r.isChanged() ? new ArrayAccessExpression(expression, indices, trailingComma) : node;
    }

    @Override
    public Node visitBinaryExpression(BinaryExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression lhs = r.rebuild(node.getLhs(), Expression.class);
        Keyword operator = r.rebuild(node.getOperator(), Keyword.class);
        Expression rhs = r.rebuild(node.getRhs(), Expression.class);
        return r.isChanged() ? new BinaryExpression(lhs, operator, rhs) : node;
    }

    @Override
    public Node visitBinaryInfixExpression(BinaryInfixExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression lhs = r.rebuild(node.getLhs(), Expression.class);
        NameExpression operator = r.rebuild(node.getOperator(), NameExpression.class);
        Expression rhs = r.rebuild(node.getRhs(), Expression.class);
        return r.isChanged() ? new BinaryInfixExpression(lhs, operator, rhs) : node;
    }

    @Override
    public Node visitBinaryTypeExpression(BinaryTypeExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression lhs = r.rebuild(node.getLhs(), Expression.class);
        Keyword operator = r.rebuild(node.getOperator(), Keyword.class);
        TypeRef rhs = r.rebuild(node.getRhs(), TypeRef.class);
        return r.isChanged() ? new BinaryTypeExpression(lhs, operator, rhs) : node;
    }

    @Override
    public Node visitBlockExpression(BlockExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<Statement> statements = r.rebuildList(node.getStatements(), Statement.class);
        return r.isChanged() ? new BlockExpression(statements) : node;
    }

    @Override
    public Node visitBreakExpression(BreakExpression node, NodePath path) {
        return node;
    }

    @Override
    public Node visitCallExpression(CallExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression callee = r.rebuild(node.getCallee(), Expression.class);
        TypeArgs typeArgs = r.rebuild(node.getTypeArgs(), TypeArgs.class);
        ValueArgs args = r.rebuild(node.getArgs(), ValueArgs.class);
        CallExpression.LambdaArg lambdaArg = r.rebuild(node.getLambdaArg(), CallExpression.LambdaArg.class);
        return r.isChanged() ? new CallExpression(callee, typeArgs, args, lambdaArg) : node;
    }

    @Override
    public Node visitLambdaArg(CallExpression.LambdaArg node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<AnnotationSet> annotationSets = r.rebuildList(node.getAnnotationSets(), AnnotationSet.class);
        LambdaExpression expression = r.rebuild(node.getExpression(), LambdaExpression.class);
        return r.isChanged() ? new CallExpression.LambdaArg(annotationSets, node.getLabel(), expression) : node;
    }

    @Override
    public Node visitCallableReferenceExpression(CallableReferenceExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression receiver = r.rebuild(node.getReceiver(), Expression.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        return r.isChanged() ? new CallableReferenceExpression(receiver, name) : node;
    }

    @Override
    public Node visitClassLiteralExpression(ClassLiteralExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression receiver = r.rebuild(node.getReceiver(), Expression.class);
        return r.isChanged() ? new ClassLiteralExpression(receiver) : node;
    }

    @Override
    public Node visitCollectionLiteralExpression(CollectionLiteralExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<Expression> expressions = r.rebuildList(node.getExpressions(), Expression.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        return r.isChanged() ? new CollectionLiteralExpression(expressions, trailingComma) : node;
    }

    @Override
    public Node visitConstantLiteralExpression(ConstantLiteralExpression node, NodePath path) {
        return node;
    }

    @Override
    public Node visitContinueExpression(ContinueExpression node, NodePath path) {
        return node;
    }

    @Override
    public Node visitDoWhileExpression(DoWhileExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword doKeyword = r.rebuild(node.getDoKeyword(), Keyword.class);
        Expression body = r.rebuild(node.getBody(), Expression.class);
        Keyword whileKeyword = r.rebuild(node.getWhileKeyword(), Keyword.class);
        Keyword lPar = r.rebuild(node.getLPar(), Keyword.class);
        Expression condition = r.rebuild(node.getCondition(), Expression.class);
        Keyword rPar = r.rebuild(node.getRPar(), Keyword.class);
        return r.isChanged() ? new DoWhileExpression(doKeyword, body, whileKeyword, lPar, condition, rPar) : node;
    }

    @Override
    public Node visitForExpression(ForExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword forKeyword = r.rebuild(node.getForKeyword(), Keyword.class);
        Keyword lPar = r.rebuild(node.getLPar(), Keyword.class);
        LambdaExpression.LambdaParam loopParam = r.rebuild(node.getLoopParam(), LambdaExpression.LambdaParam.class);
        Keyword inKeyword = r.rebuild(node.getInKeyword(), Keyword.class);
        Expression loopRange = r.rebuild(node.getLoopRange(), Expression.class);
        Keyword rPar = r.rebuild(node.getRPar(), Keyword.class);
        Expression body = r.rebuild(node.getBody(), Expression.class);
        return r.isChanged() ? new ForExpression(forKeyword, lPar, loopParam, inKeyword, loopRange, rPar, body) : node;
    }

    @Override
    public Node visitIfExpression(IfExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword ifKeyword = r.rebuild(node.getIfKeyword(), Keyword.class);
        Keyword lPar = r.rebuild(node.getLPar(), Keyword.class);
        Expression condition = r.rebuild(node.getCondition(), Expression.class);
        Keyword rPar = r.rebuild(node.getRPar(), Keyword.class);
        Expression body = r.rebuild(node.getBody(), Expression.class);
        Keyword elseKeyword = r.rebuild(node.getElseKeyword(), Keyword.class);
        Expression elseBody = r.rebuild(node.getElseBody(), Expression.class);
        return r.isChanged() ? new IfExpression(ifKeyword, lPar, condition, rPar, body, elseKeyword, elseBody) : node;
    }

    @Override
    public Node visitLabeledExpression(LabeledExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new LabeledExpression(node.getLabel(), expression) : node;
    }

    @Override
    public Node visitLambdaExpression(LambdaExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        LambdaExpression.LambdaParams params = r.rebuild(node.getParams(), LambdaExpression.LambdaParams.class);
        Keyword arrow = r.rebuild(node.getArrow(), Keyword.class);
        LambdaExpression.LambdaBody body = r.rebuild(node.getBody(), LambdaExpression.LambdaBody.class);
        return r.isChanged() ? new LambdaExpression(params, arrow, body) : node;
    }

    @Override
    public Node visitLambdaParams(LambdaExpression.LambdaParams node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<LambdaExpression.LambdaParam> elements =
                r.rebuildList(node.getElements(), LambdaExpression.LambdaParam.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        return r.isChanged() ? new LambdaExpression.LambdaParams(elements, trailingComma) : node;
    }

    @Override
    public Node visitLambdaParam(LambdaExpression.LambdaParam node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword lPar = r.rebuild(node.getLPar(), Keyword.class);
        List<Variable> variables = r.rebuildList(node.getVariables(), Variable.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        Keyword rPar = r.rebuild(node.getRPar(), Keyword.class);
        TypeRef destructTypeRef = r.rebuild(node.getDestructTypeRef(), TypeRef.class);
        if (!r.isChanged()) return node;
        return new LambdaExpression.LambdaParam(lPar, variables, trailingComma, rPar, destructTypeRef);
    }

    @Override
    public Node visitLambdaBody(LambdaExpression.LambdaBody node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<Statement> statements = r.rebuildList(node.getStatements(), Statement.class);
        return r.isChanged() ? new LambdaExpression.LambdaBody(statements) : node;
    }

    @Override
    public Node visitNameExpression(NameExpression node, NodePath path) {
        return node;
    }

    @Override
    public Node visitObjectLiteralExpression(ObjectLiteralExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        ClassDeclaration declaration = r.rebuild(node.getDeclaration(), ClassDeclaration.class);
        return r.isChanged() ? new ObjectLiteralExpression(declaration) : node;
    }

    @Override
    public Node visitParenthesizedExpression(ParenthesizedExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new ParenthesizedExpression(expression) : node;
    }

    @Override
    public Node visitPostfixUnaryExpression(PostfixUnaryExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        Keyword operator = r.rebuild(node.getOperator(), Keyword.class);
        return r.isChanged() ? new PostfixUnaryExpression(expression, operator) : node;
    }

    @Override
    public Node visitPrefixUnaryExpression(PrefixUnaryExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword operator = r.rebuild(node.getOperator(), Keyword.class);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new PrefixUnaryExpression(operator, expression) : node;
    }

    @Override
    public Node visitReturnExpression(ReturnExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new ReturnExpression(node.getLabel(), expression) : node;
    }

    @Override
    public Node visitStringLiteralExpression(StringLiteralExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<StringLiteralExpression.StringEntry> entries =
                r.rebuildList(node.getEntries(), StringLiteralExpression.StringEntry.class);
        return r.isChanged() ? new StringLiteralExpression(entries, node.isRaw()) : node;
    }

    @Override
    public Node visitLiteralStringEntry(StringLiteralExpression.LiteralStringEntry node, NodePath path) {
        return node;
    }

    @Override
    public Node visitEscapeStringEntry(StringLiteralExpression.EscapeStringEntry node, NodePath path) {
        return node;
    }

    @Override
    public Node visitTemplateStringEntry(StringLiteralExpression.TemplateStringEntry node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        if (!r.isChanged()) return node;
        return new StringLiteralExpression.TemplateStringEntry(expression, node.isShortTemplate());
    }

    @Override
    public Node visitSuperExpression(SuperExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        TypeRef typeArgType = r.rebuild(node.getTypeArgType(), TypeRef.class);
        return r.isChanged() ? new SuperExpression(typeArgType, node.getLabel()) : node;
    }

    @Override
    public Node visitThisExpression(ThisExpression node, NodePath path) {
        return node;
    }

    @Override
    public Node visitThrowExpression(ThrowExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new ThrowExpression(expression) : node;
    }

    @Override
    public Node visitTryExpression(TryExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        BlockExpression block = r.rebuild(node.getBlock(), BlockExpression.class);
        List<TryExpression.CatchClause> catchClauses =
                r.rebuildList(node.getCatchClauses(), TryExpression.CatchClause.class);
        BlockExpression finallyBlock = r.rebuild(node.getFinallyBlock(), BlockExpression.class);
        return r.isChanged() ? new TryExpression(block, catchClauses, finallyBlock) : node;
    }

    @Override
    public Node visitCatchClause(TryExpression.CatchClause node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword catchKeyword = r.rebuild(node.getCatchKeyword(), Keyword.class);
        FunctionParams params = r.rebuild(node.getParams(), FunctionParams.class);
        BlockExpression block = r.rebuild(node.getBlock(), BlockExpression.class);
        return r.isChanged() ? new TryExpression.CatchClause(catchKeyword, params, block) : node;
    }

    @Override
    public Node visitValueArg(ValueArg node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        Keyword asterisk = r.rebuild(node.getAsterisk(), Keyword.class);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new ValueArg(name, asterisk, expression) : node;
    }

    @Override
    public Node visitValueArgs(ValueArgs node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<ValueArg> elements = r.rebuildList(node.getElements(), ValueArg.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        return r.isChanged() ? new ValueArgs(elements, trailingComma) : node;
    }

    @Override
    public Node visitWhenExpression(WhenExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword whenKeyword = r.rebuild(node.getWhenKeyword(), Keyword.class);
        Keyword lPar = r.rebuild(node.getLPar(), Keyword.class);
        Expression subject = r.rebuild(node.getSubject(), Expression.class);
        Keyword rPar = r.rebuild(node.getRPar(), Keyword.class);
        List<WhenExpression.WhenBranch> branches = r.rebuildList(node.getBranches(), WhenExpression.WhenBranch.class);
        return r.isChanged() ? new WhenExpression(whenKeyword, lPar, subject, rPar, branches) : node;
    }

    @Override
    public Node visitWhenBranch(WhenExpression.WhenBranch node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<WhenExpression.WhenCondition> conditions =
                r.rebuildList(node.getConditions(), WhenExpression.WhenCondition.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        Keyword elseKeyword = r.rebuild(node.getElseKeyword(), Keyword.class);
        Keyword arrow = r.rebuild(node.getArrow(), Keyword.class);
        Expression body = r.rebuild(node.getBody(), Expression.class);
        if (!r.isChanged()) return node;
        return new WhenExpression.WhenBranch(conditions, trailingComma, elseKeyword, arrow, body);
    }

    @Override
    public Node visitWhenCondition(WhenExpression.WhenCondition node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword operator = r.rebuild(node.getOperator(), Keyword.class);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        return r.isChanged() ? new WhenExpression.WhenCondition(operator, expression, typeRef) : node;
    }

    @Override
    public Node visitWhileExpression(WhileExpression node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword whileKeyword = r.rebuild(node.getWhileKeyword(), Keyword.class);
        Keyword lPar = r.rebuild(node.getLPar(), Keyword.class);
        Expression condition = r.rebuild(node.getCondition(), Expression.class);
        Keyword rPar = r.rebuild(node.getRPar(), Keyword.class);
        Expression body = r.rebuild(node.getBody(), Expression.class);
        return r.isChanged() ? new WhileExpression(whileKeyword, lPar, condition, rPar, body) : node;
    }


    // ============ 类型 ============

    @Override
    public Node visitDynamicType(DynamicType node, NodePath path) {
        return node;
    }

    @Override
    public Node visitFunctionType(FunctionType node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        FunctionType.Receiver receiver = r.rebuild(node.getReceiver(), FunctionType.Receiver.class);
        FunctionType.Params params = r.rebuild(node.getParams(), FunctionType.Params.class);
        TypeRef returnTypeRef = r.rebuild(node.getReturnTypeRef(), TypeRef.class);
        return r.isChanged() ? new FunctionType(receiver, params, returnTypeRef) : node;
    }

    @Override
    public Node visitFunctionTypeReceiver(FunctionType.Receiver node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        return r.isChanged() ? new FunctionType.Receiver(typeRef) : node;
    }

    @Override
    public Node visitFunctionTypeParams(FunctionType.Params node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<FunctionType.Param> elements = r.rebuildList(node.getElements(), FunctionType.Param.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        return r.isChanged() ? new FunctionType.Params(elements, trailingComma) : node;
    }

    @Override
    public Node visitFunctionTypeParam(FunctionType.Param node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        return r.isChanged() ? new FunctionType.Param(name, typeRef) : node;
    }

    @Override
    public Node visitNullableType(NullableType node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword lPar = r.rebuild(node.getLPar(), Keyword.class);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Type innerType = r.rebuild(node.getInnerType(), Type.class);
        Keyword rPar = r.rebuild(node.getRPar(), Keyword.class);
        return r.isChanged() ? new NullableType(lPar, modifiers, innerType, rPar) : node;
    }

    @Override
    public Node visitSimpleType(SimpleType node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<SimpleType.Qualifier> qualifiers = r.rebuildList(node.getQualifiers(), SimpleType.Qualifier.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        TypeArgs typeArgs = r.rebuild(node.getTypeArgs(), TypeArgs.class);
        return r.isChanged() ? new SimpleType(qualifiers, name, typeArgs) : node;
    }

    @Override
    public Node visitSimpleTypeQualifier(SimpleType.Qualifier node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        TypeArgs typeArgs = r.rebuild(node.getTypeArgs(), TypeArgs.class);
        return r.isChanged() ? new SimpleType.Qualifier(name, typeArgs) : node;
    }

    @Override
    public Node visitTypeArg(TypeArg node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Keyword asterisk = r.rebuild(node.getAsterisk(), Keyword.class);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        return r.isChanged() ? new TypeArg(modifiers, asterisk, typeRef) : node;
    }

    @Override
    public Node visitTypeArgs(TypeArgs node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<TypeArg> elements = r.rebuildList(node.getElements(), TypeArg.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        return r.isChanged() ? new TypeArgs(elements, trailingComma) : node;
    }

    @Override
    public Node visitTypeRef(TypeRef node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword lPar = r.rebuild(node.getLPar(), Keyword.class);
        Modifiers modifiers = r.rebuild(node.getModifiers(), Modifiers.class);
        Type type = r.rebuild(node.getType(), Type.class);
        Keyword rPar = r.rebuild(node.getRPar(), Keyword.class);
        return r.isChanged() ? new TypeRef(lPar, modifiers, type, rPar) : node;
    }


    // ============ 修饰符 ============

    @Override
    public Node visitAnnotation(Annotation node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        SimpleType type = r.rebuild(node.getType(), SimpleType.class);
        ValueArgs args = r.rebuild(node.getArgs(), ValueArgs.class);
        return r.isChanged() ? new Annotation(type, args) : node;
    }

    @Override
    public Node visitAnnotationSet(AnnotationSet node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword atSymbol = r.rebuild(node.getAtSymbol(), Keyword.class);
        Keyword target = r.rebuild(node.getTarget(), Keyword.class);
        Keyword colon = r.rebuild(node.getColon(), Keyword.class);
        Keyword lBracket = r.rebuild(node.getLBracket(), Keyword.class);
        List<Annotation> annotations = r.rebuildList(node.getAnnotations(), Annotation.class);
        Keyword rBracket = r.rebuild(node.getRBracket(), Keyword.class);
        return r.isChanged() ? new AnnotationSet(atSymbol, target, colon, lBracket, annotations, rBracket) : node;
    }

    @Override
    public Node visitContract(Contract node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword contractKeyword = r.rebuild(node.getContractKeyword(), Keyword.class);
        Contract.ContractEffects effects = r.rebuild(node.getEffects(), Contract.ContractEffects.class);
        return r.isChanged() ? new Contract(contractKeyword, effects) : node;
    }

    @Override
    public Node visitContractEffects(Contract.ContractEffects node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<Contract.ContractEffect> elements = r.rebuildList(node.getElements(), Contract.ContractEffect.class);
        Keyword trailingComma = r.rebuild(node.getTrailingComma(), Keyword.class);
        return r.isChanged() ? new Contract.ContractEffects(elements, trailingComma) : node;
    }

    @Override
    public Node visitContractEffect(Contract.ContractEffect node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Expression expression = r.rebuild(node.getExpression(), Expression.class);
        return r.isChanged() ? new Contract.ContractEffect(expression) : node;
    }

    @Override
    public Node visitKeyword(Keyword node, NodePath path) {
        return node;
    }

    @Override
    public Node visitModifiers(Modifiers node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<Modifier> elements = r.rebuildList(node.getElements(), Modifier.class);
        return r.isChanged() ? new Modifiers(elements) : node;
    }

    @Override
    public Node visitTypeConstraintSet(TypeConstraintSet node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        Keyword whereKeyword = r.rebuild(node.getWhereKeyword(), Keyword.class);
        TypeConstraintSet.TypeConstraints constraints =
                r.rebuild(node.getConstraints(), TypeConstraintSet.TypeConstraints.class);
        return r.isChanged() ? new TypeConstraintSet(whereKeyword, constraints) : node;
    }

    @Override
    public Node visitTypeConstraints(TypeConstraintSet.TypeConstraints node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<TypeConstraintSet.TypeConstraint> elements =
                r.rebuildList(node.getElements(), TypeConstraintSet.TypeConstraint.class);
        return r.isChanged() ? new TypeConstraintSet.TypeConstraints(elements) : node;
    }

    @Override
    public Node visitTypeConstraint(TypeConstraintSet.TypeConstraint node, NodePath path) {
        ChildRebuilder r = new ChildRebuilder(path);
        List<AnnotationSet> annotationSets = r.rebuildList(node.getAnnotationSets(), AnnotationSet.class);
        NameExpression name = r.rebuild(node.getName(), NameExpression.class);
        TypeRef typeRef = r.rebuild(node.getTypeRef(), TypeRef.class);
        return r.isChanged() ? new TypeConstraintSet.TypeConstraint(annotationSets, name, typeRef) : node;
    }


    // ============ 附加信息 ============

    @Override
    public Node visitBlankLines(BlankLines node, NodePath path) {
        throw extraInTree(node);
    }

    @Override
    public Node visitComment(Comment node, NodePath path) {
        throw extraInTree(node);
    }

    @Override
    public Node visitSemicolon(Semicolon node, NodePath path) {
        throw extraInTree(node);
    }

    @Override
    public Node visitTrailingComma(TrailingComma node, NodePath path) {
        throw extraInTree(node);
    }

    @Override
    public Node visitWhitespace(Whitespace node, NodePath path) {
        throw extraInTree(node);
    }
}
