package com.ktast.ast;

import com.ktast.ast.decl.*;
import com.ktast.ast.expr.*;
import com.ktast.ast.extra.*;
import com.ktast.ast.modifier.*;
import com.ktast.ast.type.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 源码输出器
 *
 * <p>按槽位顺序深度优先输出语法树。给出附加信息映射时，附加信息原样写在节点前、内、后，
 * 使用解析时得到的映射可以逐字节还原源码；缺少附加信息的位置用启发式规则补空格、换行和分号，
 * 保证输出仍能被重新解析为相同的语法树。</p>
 */
public class Writer extends Visitor implements NodeVisitor<Void, NodePath> {

    /**
     * 相邻两个输出片段之间是否需要空格
     */
    public interface SpaceRule {
        boolean needsSpace(String last, String next);
    }

    /**
     * 即将输出的节点之前是否需要换行或分号
     *
     * <p>previous 为节点在所在语句列表（或分支列表、访问器列表）中的前一个兄弟，没有时为 null</p>
     */
    public interface NodeRule {
        boolean test(NodePath path, Node previous);
    }

    // ============ 默认规则 ============

    /** 两个单词字符相邻 */
    public static final SpaceRule ADJACENT_WORDS = (last, next) ->
            isWordChar(last.charAt(last.length() - 1)) && isWordChar(next.charAt(0));

    /** 避免 '>' 与 '=' 组成 '>=' */
    public static final SpaceRule GREATER_BEFORE_EQUALS = (last, next) ->
            last.endsWith(">") && next.startsWith("=");

    /** 避免 '+' '+' 组成 '++'，'-' '-' 组成 '--' */
    public static final SpaceRule DOUBLED_SIGN = (last, next) ->
            (last.equals("+") && next.startsWith("+")) || (last.equals("-") && next.startsWith("-"));

    /** 避免除号与注释开头相连 */
    public static final SpaceRule SLASH_BEFORE_COMMENT = (last, next) ->
            last.endsWith("/") && (next.startsWith("/") || next.startsWith("*"));

    /** 单词后紧跟 '@' 会被读成标签 */
    public static final SpaceRule WORD_BEFORE_AT = (last, next) ->
            isWordChar(last.charAt(last.length() - 1)) && next.startsWith("@");

    /** 容器中不是第一个的语句或声明（枚举项之间用逗号分隔，不在此列） */
    public static final NodeRule STATEMENT_NOT_FIRST = (path, previous) -> {
        Node node = path.getNode();
        Node parent = path.getParentNode();
        if (previous == null || node instanceof ClassDeclaration.EnumEntry) return false;
        return parent instanceof KotlinFile || parent instanceof KotlinScript
                || parent instanceof BlockExpression || parent instanceof LambdaExpression.LambdaBody
                || parent instanceof ClassDeclaration.ClassBody;
    };

    /** when 中不是第一个的分支 */
    public static final NodeRule WHEN_BRANCH_NOT_FIRST = (path, previous) ->
            path.getNode() instanceof WhenExpression.WhenBranch && previous != null;

    /** 跟在表达式初始化值、委托或表达式体访问器之后的访问器 */
    public static final NodeRule ACCESSOR_AFTER_EXPRESSION = (path, previous) -> {
        if (!(path.getNode() instanceof PropertyDeclaration.Accessor)) return false;
        if (previous != null) {
            return ((PropertyDeclaration.Accessor) previous).hasExpressionBody();
        }
        Node parent = path.getParentNode();
        if (!(parent instanceof PropertyDeclaration)) return false;
        PropertyDeclaration property = (PropertyDeclaration) parent;
        return property.getInitializer() != null || property.getDelegate() != null;
    };

    /** 注解表达式包裹的二元运算：换行后注解作用于整个表达式 */
    public static final NodeRule BINARY_AFTER_ANNOTATIONS = (path, previous) ->
            (path.getNode() instanceof BinaryExpression || path.getNode() instanceof BinaryTypeExpression)
                    && path.getParentNode() instanceof AnnotatedExpression;

    /** 与修饰符同名的名字表达式之后紧跟声明 */
    public static final NodeRule DECLARATION_AFTER_MODIFIER_NAME = (path, previous) ->
            previous instanceof NameExpression && path.getNode() instanceof Declaration
                    && Keyword.Type.isModifierText(((NameExpression) previous).getText());

    /** 不带尾随 lambda 的调用之后紧跟独立的 lambda */
    public static final NodeRule LAMBDA_AFTER_CALL = (path, previous) ->
            previous instanceof CallExpression && ((CallExpression) previous).getLambdaArg() == null
                    && isLambdaLike(path.getNode());

    protected final List<SpaceRule> spaceRules = new ArrayList<SpaceRule>();
    protected final List<NodeRule> newlineRules = new ArrayList<NodeRule>();
    protected final List<NodeRule> semicolonRules = new ArrayList<NodeRule>();

    private final WriterContext ctx = new WriterContext();
    private final ExtrasMap extrasMap;
    private boolean withinWritten;
    private boolean inString;
    private boolean pendingAnnotationSpace;

    protected Writer(ExtrasMap extrasMap) {
        this.extrasMap = extrasMap;
        Collections.addAll(spaceRules, ADJACENT_WORDS, GREATER_BEFORE_EQUALS, DOUBLED_SIGN, SLASH_BEFORE_COMMENT,
                WORD_BEFORE_AT);
        Collections.addAll(newlineRules, STATEMENT_NOT_FIRST, WHEN_BRANCH_NOT_FIRST, ACCESSOR_AFTER_EXPRESSION,
                BINARY_AFTER_ANNOTATIONS);
        Collections.addAll(semicolonRules, DECLARATION_AFTER_MODIFIER_NAME, LAMBDA_AFTER_CALL);
    }

    /**
     * 不带附加信息输出，只保证词法上有效
     */
    public static String write(Node root) {
        return write(root, null);
    }

    /**
     * 带附加信息输出
     */
    public static String write(Node root, ExtrasMap extrasMap) {
        Writer writer = new Writer(extrasMap);
        return writer.write(NodePath.rootPath(root));
    }

    protected String write(NodePath rootPath) {
        visit(rootPath);
        return ctx.getOutput();
    }

    @Override
    protected void visit(NodePath path) {
        Node node = path.getNode();
        writeExtras(extrasBefore(node));

        Node previous = previousSibling(path);
        if (!ctx.isNewlineOrSemicolonSinceToken() && matches(semicolonRules, path, previous)) {
            ctx.semicolon();
        }
        if (!ctx.isNewlineOrSemicolonSinceToken() && !keepsAdjacentMember(path, previous)
                && matches(newlineRules, path, previous)) {
            ctx.newLine();
        }

        boolean savedWithin = withinWritten;
        withinWritten = false;
        node.accept(this, path);
        if (!withinWritten) {
            writeExtras(extrasWithin(node));
        }
        withinWritten = savedWithin;

        writeExtras(extrasAfter(node));
    }

    // ============ 声明 ============

    @Override
    public Void visitKotlinFile(KotlinFile node, NodePath path) {
        children(path, node.getChildren());
        return null;
    }

    @Override
    public Void visitKotlinScript(KotlinScript node, NodePath path) {
        children(path, node.getChildren());
        return null;
    }

    @Override
    public Void visitPackageDirective(PackageDirective node, NodePath path) {
        child(path, node.getPackageKeyword());
        children(path, node.getNames(), ".");
        return null;
    }

    @Override
    public Void visitImportDirective(ImportDirective node, NodePath path) {
        child(path, node.getImportKeyword());
        children(path, node.getNames(), ".");
        if (node.getAsterisk() != null) {
            token(".");
            child(path, node.getAsterisk());
        }
        child(path, node.getAlias());
        return null;
    }

    @Override
    public Void visitImportAlias(ImportDirective.ImportAlias node, NodePath path) {
        child(path, node.getAsKeyword());
        child(path, node.getName());
        return null;
    }

    @Override
    public Void visitClassDeclaration(ClassDeclaration node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getDeclarationKeyword());
        child(path, node.getName());
        child(path, node.getTypeParams());
        child(path, node.getPrimaryConstructor());
        if (node.getClassParents() != null) {
            token(":");
            child(path, node.getClassParents());
        }
        child(path, node.getTypeConstraintSet());
        child(path, node.getClassBody());
        return null;
    }

    @Override
    public Void visitPrimaryConstructor(ClassDeclaration.PrimaryConstructor node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getConstructorKeyword());
        child(path, node.getParams());
        return null;
    }

    @Override
    public Void visitClassParents(ClassDeclaration.ClassParents node, NodePath path) {
        children(path, node.getElements(), ",");
        return null;
    }

    @Override
    public Void visitCallConstructorParent(ClassDeclaration.CallConstructorParent node, NodePath path) {
        child(path, node.getType());
        child(path, node.getArgs());
        return null;
    }

    @Override
    public Void visitDelegationParent(ClassDeclaration.DelegationParent node, NodePath path) {
        child(path, node.getType());
        child(path, node.getByKeyword());
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitTypeParent(ClassDeclaration.TypeParent node, NodePath path) {
        child(path, node.getType());
        return null;
    }

    @Override
    public Void visitClassBody(ClassDeclaration.ClassBody node, NodePath path) {
        token("{");
        children(path, node.getEnumEntries(), ",");
        if (!node.getEnumEntries().isEmpty() && !node.getDeclarations().isEmpty()
                && !ctx.isSemicolonSinceToken()
                && !containsSemicolon(extrasBefore(node.getDeclarations().get(0)))) {
            ctx.semicolon();
        }
        children(path, node.getDeclarations());
        closing(path, "}");
        return null;
    }

    @Override
    public Void visitEnumEntry(ClassDeclaration.EnumEntry node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getName());
        child(path, node.getArgs());
        child(path, node.getClassBody());
        return null;
    }

    @Override
    public Void visitFunctionDeclaration(FunctionDeclaration node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getFunKeyword());
        child(path, node.getTypeParams());
        if (node.getReceiverTypeRef() != null) {
            child(path, node.getReceiverTypeRef());
            token(".");
        }
        child(path, node.getName());
        child(path, node.getParams());
        if (node.getReturnTypeRef() != null) {
            token(":");
            child(path, node.getReturnTypeRef());
        }
        children(path, node.getPostModifiers());
        child(path, node.getEquals());
        child(path, node.getBody());
        return null;
    }

    @Override
    public Void visitFunctionParam(FunctionParam node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getValOrVarKeyword());
        child(path, node.getName());
        if (node.getTypeRef() != null) {
            token(":");
            child(path, node.getTypeRef());
        }
        child(path, node.getEquals());
        child(path, node.getDefaultValue());
        return null;
    }

    @Override
    public Void visitFunctionParams(FunctionParams node, NodePath path) {
        token("(");
        children(path, node.getElements(), ",");
        child(path, node.getTrailingComma());
        closing(path, ")");
        return null;
    }

    @Override
    public Void visitInitDeclaration(InitDeclaration node, NodePath path) {
        child(path, node.getModifiers());
        token("init");
        child(path, node.getBlock());
        return null;
    }

    @Override
    public Void visitPropertyDeclaration(PropertyDeclaration node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getValOrVarKeyword());
        child(path, node.getTypeParams());
        if (node.getReceiverTypeRef() != null) {
            child(path, node.getReceiverTypeRef());
            token(".");
        }
        child(path, node.getLPar());
        children(path, node.getVariables(), ",");
        child(path, node.getTrailingComma());
        child(path, node.getRPar());
        child(path, node.getTypeConstraintSet());
        child(path, node.getEquals());
        child(path, node.getInitializer());
        child(path, node.getDelegate());
        children(path, node.getAccessors());
        return null;
    }

    @Override
    public Void visitPropertyDelegate(PropertyDeclaration.PropertyDelegate node, NodePath path) {
        child(path, node.getByKeyword());
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitGetter(PropertyDeclaration.Getter node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getGetKeyword());
        if (node.getBody() != null) {
            token("(");
            token(")");
        }
        if (node.getTypeRef() != null) {
            token(":");
            child(path, node.getTypeRef());
        }
        children(path, node.getPostModifiers());
        child(path, node.getEquals());
        child(path, node.getBody());
        return null;
    }

    @Override
    public Void visitSetter(PropertyDeclaration.Setter node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getSetKeyword());
        child(path, node.getParams());
        children(path, node.getPostModifiers());
        child(path, node.getEquals());
        child(path, node.getBody());
        return null;
    }

    @Override
    public Void visitSecondaryConstructorDeclaration(SecondaryConstructorDeclaration node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getConstructorKeyword());
        child(path, node.getParams());
        if (node.getDelegationCall() != null) {
            token(":");
            child(path, node.getDelegationCall());
        }
        child(path, node.getBlock());
        return null;
    }

    @Override
    public Void visitDelegationCall(SecondaryConstructorDeclaration.DelegationCall node, NodePath path) {
        child(path, node.getTarget());
        child(path, node.getArgs());
        return null;
    }

    @Override
    public Void visitTypeAliasDeclaration(TypeAliasDeclaration node, NodePath path) {
        child(path, node.getModifiers());
        token("typealias");
        child(path, node.getName());
        child(path, node.getTypeParams());
        token("=");
        child(path, node.getTypeRef());
        return null;
    }

    @Override
    public Void visitTypeParam(TypeParam node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getName());
        if (node.getTypeRef() != null) {
            token(":");
            child(path, node.getTypeRef());
        }
        return null;
    }

    @Override
    public Void visitTypeParams(TypeParams node, NodePath path) {
        token("<");
        children(path, node.getElements(), ",");
        child(path, node.getTrailingComma());
        closing(path, ">");
        return null;
    }

    @Override
    public Void visitVariable(Variable node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getName());
        if (node.getTypeRef() != null) {
            token(":");
            child(path, node.getTypeRef());
        }
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitAnnotatedExpression(AnnotatedExpression node, NodePath path) {
        children(path, node.getAnnotationSets());
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitAnonymousFunctionExpression(AnonymousFunctionExpression node, NodePath path) {
        child(path, node.getFunction());
        return null;
    }

    @Override
    public Void visitArrayAccessExpression(ArrayAccessExpression node, NodePath path) {
        child(path, node.getExpression());
        token("[");
        children(path, node.getIndices(), ",");
        child(path, node.getTrailingComma());
        closing(path, "]");
        return null;
    }

    @Override
    public Void visitBinaryExpression(BinaryExpression node, NodePath path) {
        child(path, node.getLhs());
        child(path, node.getOperator());
        child(path, node.getRhs());
        return null;
    }

    @Override
    public Void visitBinaryInfixExpression(BinaryInfixExpression node, NodePath path) {
        child(path, node.getLhs());
        child(path, node.getOperator());
        child(path, node.getRhs());
        return null;
    }

    @Override
    public Void visitBinaryTypeExpression(BinaryTypeExpression node, NodePath path) {
        child(path, node.getLhs());
        child(path, node.getOperator());
        child(path, node.getRhs());
        return null;
    }

    @Override
    public Void visitBlockExpression(BlockExpression node, NodePath path) {
        token("{");
        children(path, node.getStatements());
        closing(path, "}");
        return null;
    }

    @Override
    public Void visitBreakExpression(BreakExpression node, NodePath path) {
        token(labeled("break", node.getLabel()));
        return null;
    }

    @Override
    public Void visitCallExpression(CallExpression node, NodePath path) {
        child(path, node.getCallee());
        child(path, node.getTypeArgs());
        child(path, node.getArgs());
        child(path, node.getLambdaArg());
        return null;
    }

    @Override
    public Void visitLambdaArg(CallExpression.LambdaArg node, NodePath path) {
        children(path, node.getAnnotationSets());
        if (node.getLabel() != null) {
            token(node.getLabel() + "@");
        }
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitCallableReferenceExpression(CallableReferenceExpression node, NodePath path) {
        child(path, node.getReceiver());
        token("::");
        child(path, node.getName());
        return null;
    }

    @Override
    public Void visitClassLiteralExpression(ClassLiteralExpression node, NodePath path) {
        child(path, node.getReceiver());
        token("::");
        token("class");
        return null;
    }

    @Override
    public Void visitCollectionLiteralExpression(CollectionLiteralExpression node, NodePath path) {
        token("[");
        children(path, node.getExpressions(), ",");
        child(path, node.getTrailingComma());
        closing(path, "]");
        return null;
    }

    @Override
    public Void visitConstantLiteralExpression(ConstantLiteralExpression node, NodePath path) {
        token(node.getText());
        return null;
    }

    @Override
    public Void visitContinueExpression(ContinueExpression node, NodePath path) {
        token(labeled("continue", node.getLabel()));
        return null;
    }

    @Override
    public Void visitDoWhileExpression(DoWhileExpression node, NodePath path) {
        child(path, node.getDoKeyword());
        child(path, node.getBody());
        child(path, node.getWhileKeyword());
        child(path, node.getLPar());
        child(path, node.getCondition());
        child(path, node.getRPar());
        return null;
    }

    @Override
    public Void visitForExpression(ForExpression node, NodePath path) {
        child(path, node.getForKeyword());
        child(path, node.getLPar());
        child(path, node.getLoopParam());
        child(path, node.getInKeyword());
        child(path, node.getLoopRange());
        child(path, node.getRPar());
        child(path, node.getBody());
        return null;
    }

    @Override
    public Void visitIfExpression(IfExpression node, NodePath path) {
        child(path, node.getIfKeyword());
        child(path, node.getLPar());
        child(path, node.getCondition());
        child(path, node.getRPar());
        child(path, node.getBody());
        child(path, node.getElseKeyword());
        child(path, node.getElseBody());
        return null;
    }

    @Override
    public Void visitLabeledExpression(LabeledExpression node, NodePath path) {
        token(node.getLabel() + "@");
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitLambdaExpression(LambdaExpression node, NodePath path) {
        token("{");
        child(path, node.getParams());
        child(path, node.getArrow());
        child(path, node.getBody());
        closing(path, "}");
        return null;
    }

    @Override
    public Void visitLambdaParams(LambdaExpression.LambdaParams node, NodePath path) {
        children(path, node.getElements(), ",");
        child(path, node.getTrailingComma());
        return null;
    }

    @Override
    public Void visitLambdaParam(LambdaExpression.LambdaParam node, NodePath path) {
        child(path, node.getLPar());
        children(path, node.getVariables(), ",");
        child(path, node.getTrailingComma());
        child(path, node.getRPar());
        if (node.getDestructTypeRef() != null) {
            token(":");
            child(path, node.getDestructTypeRef());
        }
        return null;
    }

    @Override
    public Void visitLambdaBody(LambdaExpression.LambdaBody node, NodePath path) {
        children(path, node.getStatements());
        return null;
    }

    @Override
    public Void visitNameExpression(NameExpression node, NodePath path) {
        token(node.getText());
        return null;
    }

    @Override
    public Void visitObjectLiteralExpression(ObjectLiteralExpression node, NodePath path) {
        child(path, node.getDeclaration());
        return null;
    }

    @Override
    public Void visitParenthesizedExpression(ParenthesizedExpression node, NodePath path) {
        token("(");
        child(path, node.getExpression());
        closing(path, ")");
        return null;
    }

    @Override
    public Void visitPostfixUnaryExpression(PostfixUnaryExpression node, NodePath path) {
        child(path, node.getExpression());
        child(path, node.getOperator());
        return null;
    }

    @Override
    public Void visitPrefixUnaryExpression(PrefixUnaryExpression node, NodePath path) {
        child(path, node.getOperator());
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitReturnExpression(ReturnExpression node, NodePath path) {
        token(labeled("return", node.getLabel()));
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitStringLiteralExpression(StringLiteralExpression node, NodePath path) {
        String quote = node.isRaw() ? "\"\"\"" : "\"";
        token(quote);
        boolean saved = inString;
        inString = true;
        children(path, node.getEntries());
        token(quote);
        inString = saved;
        return null;
    }

    @Override
    public Void visitLiteralStringEntry(StringLiteralExpression.LiteralStringEntry node, NodePath path) {
        token(node.getText());
        return null;
    }

    @Override
    public Void visitEscapeStringEntry(StringLiteralExpression.EscapeStringEntry node, NodePath path) {
        token(node.getText());
        return null;
    }

    @Override
    public Void visitTemplateStringEntry(StringLiteralExpression.TemplateStringEntry node, NodePath path) {
        if (node.isShortTemplate()) {
            token("$");
            child(path, node.getExpression());
            return null;
        }
        token("${");
        boolean saved = inString;
        inString = false;
        child(path, node.getExpression());
        closing(path, "}");
        inString = saved;
        return null;
    }

    @Override
    public Void visitSuperExpression(SuperExpression node, NodePath path) {
        if (node.getTypeArgType() == null) {
            token(labeled("super", node.getLabel()));
            return null;
        }
        token("super");
        token("<");
        child(path, node.getTypeArgType());
        token(">");
        if (node.getLabel() != null) {
            token("@" + node.getLabel());
        }
        return null;
    }

    @Override
    public Void visitThisExpression(ThisExpression node, NodePath path) {
        token(labeled("this", node.getLabel()));
        return null;
    }

    @Override
    public Void visitThrowExpression(ThrowExpression node, NodePath path) {
        token("throw");
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitTryExpression(TryExpression node, NodePath path) {
        token("try");
        child(path, node.getBlock());
        children(path, node.getCatchClauses());
        if (node.getFinallyBlock() != null) {
            token("finally");
            child(path, node.getFinallyBlock());
        }
        return null;
    }

    @Override
    public Void visitCatchClause(TryExpression.CatchClause node, NodePath path) {
        child(path, node.getCatchKeyword());
        child(path, node.getParams());
        child(path, node.getBlock());
        return null;
    }

    @Override
    public Void visitValueArg(ValueArg node, NodePath path) {
        if (node.getName() != null) {
            child(path, node.getName());
            token("=");
        }
        child(path, node.getAsterisk());
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitValueArgs(ValueArgs node, NodePath path) {
        token("(");
        children(path, node.getElements(), ",");
        child(path, node.getTrailingComma());
        closing(path, ")");
        return null;
    }

    @Override
    public Void visitWhenExpression(WhenExpression node, NodePath path) {
        child(path, node.getWhenKeyword());
        child(path, node.getLPar());
        child(path, node.getSubject());
        child(path, node.getRPar());
        token("{");
        children(path, node.getBranches());
        closing(path, "}");
        return null;
    }

    @Override
    public Void visitWhenBranch(WhenExpression.WhenBranch node, NodePath path) {
        children(path, node.getConditions(), ",");
        child(path, node.getTrailingComma());
        child(path, node.getElseKeyword());
        child(path, node.getArrow());
        child(path, node.getBody());
        return null;
    }

    @Override
    public Void visitWhenCondition(WhenExpression.WhenCondition node, NodePath path) {
        child(path, node.getOperator());
        child(path, node.getExpression());
        child(path, node.getTypeRef());
        return null;
    }

    @Override
    public Void visitWhileExpression(WhileExpression node, NodePath path) {
        child(path, node.getWhileKeyword());
        child(path, node.getLPar());
        child(path, node.getCondition());
        child(path, node.getRPar());
        child(path, node.getBody());
        return null;
    }

    // ============ 类型 ============

    @Override
    public Void visitDynamicType(DynamicType node, NodePath path) {
        token("dynamic");
        return null;
    }

    @Override
    public Void visitFunctionType(FunctionType node, NodePath path) {
        if (node.getReceiver() != null) {
            child(path, node.getReceiver());
            token(".");
        }
        child(path, node.getParams());
        token("->");
        child(path, node.getReturnTypeRef());
        return null;
    }

    @Override
    public Void visitFunctionTypeReceiver(FunctionType.Receiver node, NodePath path) {
        child(path, node.getTypeRef());
        return null;
    }

    @Override
    public Void visitFunctionTypeParams(FunctionType.Params node, NodePath path) {
        token("(");
        children(path, node.getElements(), ",");
        child(path, node.getTrailingComma());
        closing(path, ")");
        return null;
    }

    @Override
    public Void visitFunctionTypeParam(FunctionType.Param node, NodePath path) {
        if (node.getName() != null) {
            child(path, node.getName());
            token(":");
        }
        child(path, node.getTypeRef());
        return null;
    }

    @Override
    public Void visitNullableType(NullableType node, NodePath path) {
        child(path, node.getLPar());
        child(path, node.getModifiers());
        child(path, node.getInnerType());
        child(path, node.getRPar());
        token("?");
        return null;
    }

    @Override
    public Void visitSimpleType(SimpleType node, NodePath path) {
        for (SimpleType.Qualifier qualifier : node.getQualifiers()) {
            child(path, qualifier);
            token(".");
        }
        child(path, node.getName());
        child(path, node.getTypeArgs());
        return null;
    }

    @Override
    public Void visitSimpleTypeQualifier(SimpleType.Qualifier node, NodePath path) {
        child(path, node.getName());
        child(path, node.getTypeArgs());
        return null;
    }

    @Override
    public Void visitTypeArg(TypeArg node, NodePath path) {
        child(path, node.getModifiers());
        child(path, node.getAsterisk());
        child(path, node.getTypeRef());
        return null;
    }

    @Override
    public Void visitTypeArgs(TypeArgs node, NodePath path) {
        token("<");
        children(path, node.getElements(), ",");
        child(path, node.getTrailingComma());
        closing(path, ">");
        return null;
    }

    @Override
    public Void visitTypeRef(TypeRef node, NodePath path) {
        child(path, node.getLPar());
        child(path, node.getModifiers());
        child(path, node.getType());
        child(path, node.getRPar());
        return null;
    }

    // ============ 修饰符 ============

    @Override
    public Void visitAnnotation(Annotation node, NodePath path) {
        child(path, node.getType());
        child(path, node.getArgs());
        return null;
    }

    @Override
    public Void visitAnnotationSet(AnnotationSet node, NodePath path) {
        child(path, node.getAtSymbol());
        child(path, node.getTarget());
        child(path, node.getColon());
        child(path, node.getLBracket());
        children(path, node.getAnnotations());
        child(path, node.getRBracket());
        if (!node.isBracketed()) {
            pendingAnnotationSpace = true;
        }
        return null;
    }

    @Override
    public Void visitContract(Contract node, NodePath path) {
        child(path, node.getContractKeyword());
        child(path, node.getEffects());
        return null;
    }

    @Override
    public Void visitContractEffects(Contract.ContractEffects node, NodePath path) {
        token("[");
        children(path, node.getElements(), ",");
        child(path, node.getTrailingComma());
        closing(path, "]");
        return null;
    }

    @Override
    public Void visitContractEffect(Contract.ContractEffect node, NodePath path) {
        child(path, node.getExpression());
        return null;
    }

    @Override
    public Void visitKeyword(Keyword node, NodePath path) {
        token(node.getText());
        return null;
    }

    @Override
    public Void visitModifiers(Modifiers node, NodePath path) {
        children(path, node.getElements());
        return null;
    }

    @Override
    public Void visitTypeConstraintSet(TypeConstraintSet node, NodePath path) {
        child(path, node.getWhereKeyword());
        child(path, node.getConstraints());
        return null;
    }

    @Override
    public Void visitTypeConstraints(TypeConstraintSet.TypeConstraints node, NodePath path) {
        children(path, node.getElements(), ",");
        return null;
    }

    @Override
    public Void visitTypeConstraint(TypeConstraintSet.TypeConstraint node, NodePath path) {
        children(path, node.getAnnotationSets());
        child(path, node.getName());
        token(":");
        child(path, node.getTypeRef());
        return null;
    }

    // ============ 附加信息 ============

    @Override
    public Void visitBlankLines(BlankLines node, NodePath path) {
        throw extraInTree(node);
    }

    @Override
    public Void visitComment(Comment node, NodePath path) {
        throw extraInTree(node);
    }

    @Override
    public Void visitSemicolon(Semicolon node, NodePath path) {
        throw extraInTree(node);
    }

    @Override
    public Void visitTrailingComma(TrailingComma node, NodePath path) {
        throw extraInTree(node);
    }

    @Override
    public Void visitWhitespace(Whitespace node, NodePath path) {
        throw extraInTree(node);
    }

    // ============ 辅助方法 ============

    private void child(NodePath parent, Node child) {
        if (child != null) {
            visit(parent.childPath(child));
        }
    }

    private void children(NodePath parent, List<?> children) {
        children(parent, children, null);
    }

    private void children(NodePath parent, List<?> children, String separator) {
        for (int i = 0; i < children.size(); i++) {
            if (i > 0 && separator != null) {
                token(separator);
            }
            child(parent, (Node) children.get(i));
        }
    }

    /**
     * 输出节点的右括号，之前先写出节点内部的附加信息
     */
    private void closing(NodePath path, String text) {
        writeExtras(extrasWithin(path.getNode()));
        withinWritten = true;
        token(text);
    }

    private void token(String text) {
        if (text.isEmpty()) return;
        boolean space = false;
        String last = ctx.getLastText();
        if (pendingAnnotationSpace) {
            pendingAnnotationSpace = false;
            space = !last.isEmpty() && !Character.isWhitespace(last.charAt(last.length() - 1));
        } else if (!inString) {
            space = needsSpace(last, text);
        }
        ctx.appendToken(text, space);
    }

    private void writeExtras(List<Extra> extras) {
        for (Extra extra : extras) {
            String text = extra.getText();
            boolean space = extra instanceof Comment && needsSpace(ctx.getLastText(), text);
            pendingAnnotationSpace = false;
            ctx.appendExtra(text, space, extra instanceof Semicolon,
                    extra instanceof Comment && ((Comment) extra).isLineComment());
        }
    }

    private boolean needsSpace(String last, String next) {
        if (last.isEmpty() || next.isEmpty()) return false;
        if (Character.isWhitespace(last.charAt(last.length() - 1)) || Character.isWhitespace(next.charAt(0))) {
            return false;
        }
        for (SpaceRule rule : spaceRules) {
            if (rule.needsSpace(last, next)) return true;
        }
        return false;
    }

    private static boolean matches(List<NodeRule> rules, NodePath path, Node previous) {
        for (NodeRule rule : rules) {
            if (rule.test(path, previous)) return true;
        }
        return false;
    }

    private List<Extra> extrasBefore(Node node) {
        return extrasMap == null ? Collections.<Extra>emptyList() : extrasMap.extrasBefore(node);
    }

    private List<Extra> extrasWithin(Node node) {
        return extrasMap == null ? Collections.<Extra>emptyList() : extrasMap.extrasWithin(node);
    }

    private List<Extra> extrasAfter(Node node) {
        return extrasMap == null ? Collections.<Extra>emptyList() : extrasMap.extrasAfter(node);
    }

    private static boolean containsSemicolon(List<Extra> extras) {
        for (Extra extra : extras) {
            if (extra instanceof Semicolon) return true;
        }
        return false;
    }

    /**
     * 节点在所在列表中的前一个兄弟
     */
    /**
     * 文件顶层或类体中紧跟在以代码块结尾的声明之后、且前面已写出同一行附加信息的声明保持在同一行
     */
    private boolean keepsAdjacentMember(NodePath path, Node previous) {
        Node parent = path.getParentNode();
        return path.getNode() instanceof Declaration && endsWithBlock(previous)
                && (parent instanceof KotlinFile || parent instanceof ClassDeclaration.ClassBody)
                && !extrasBefore(path.getNode()).isEmpty();
    }

    /** 声明的最后一个片段是代码块或类体的右花括号，后面的内容不会被它吸收 */
    static boolean endsWithBlock(Node declaration) {
        if (declaration instanceof ClassDeclaration) {
            return ((ClassDeclaration) declaration).getClassBody() != null;
        }
        if (declaration instanceof FunctionDeclaration) {
            FunctionDeclaration function = (FunctionDeclaration) declaration;
            return function.hasBody() && !function.hasExpressionBody();
        }
        if (declaration instanceof SecondaryConstructorDeclaration) {
            return ((SecondaryConstructorDeclaration) declaration).getBlock() != null;
        }
        if (declaration instanceof InitDeclaration) {
            return true;
        }
        if (declaration instanceof PropertyDeclaration) {
            List<PropertyDeclaration.Accessor> accessors = ((PropertyDeclaration) declaration).getAccessors();
            if (accessors.isEmpty()) return false;
            PropertyDeclaration.Accessor last = accessors.get(accessors.size() - 1);
            return last.getBody() != null && !last.hasExpressionBody();
        }
        return false;
    }

    static Node previousSibling(NodePath path) {
        Node parent = path.getParentNode();
        if (parent == null) return null;
        Node node = path.getNode();
        List<? extends Node> siblings;
        if (parent instanceof KotlinFile || parent instanceof KotlinScript
                || parent instanceof ClassDeclaration.ClassBody) {
            siblings = parent.getChildren();
        } else if (parent instanceof StatementsContainer) {
            siblings = ((StatementsContainer) parent).getStatements();
        } else if (parent instanceof WhenExpression) {
            siblings = ((WhenExpression) parent).getBranches();
        } else if (parent instanceof PropertyDeclaration && node instanceof PropertyDeclaration.Accessor) {
            siblings = ((PropertyDeclaration) parent).getAccessors();
        } else {
            return null;
        }
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == node) {
                return i == 0 ? null : siblings.get(i - 1);
            }
        }
        return null;
    }

    private static boolean isLambdaLike(Node node) {
        if (node instanceof LambdaExpression) return true;
        if (node instanceof AnnotatedExpression) return isLambdaLike(((AnnotatedExpression) node).getExpression());
        if (node instanceof LabeledExpression) return isLambdaLike(((LabeledExpression) node).getExpression());
        return false;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static String labeled(String keyword, String label) {
        return label == null ? keyword : keyword + "@" + label;
    }

    private static IllegalStateException extraInTree(Extra extra) {
        return new IllegalStateException("Extra " + extra.getKindName() + " cannot appear inside a syntax tree");
    }
}
