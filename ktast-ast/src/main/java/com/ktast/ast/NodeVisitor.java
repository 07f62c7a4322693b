package com.ktast.ast;

import com.ktast.ast.decl.ClassDeclaration;
import com.ktast.ast.decl.FunctionDeclaration;
import com.ktast.ast.decl.FunctionParam;
import com.ktast.ast.decl.FunctionParams;
import com.ktast.ast.decl.ImportDirective;
import com.ktast.ast.decl.InitDeclaration;
import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.KotlinScript;
import com.ktast.ast.decl.PackageDirective;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.decl.SecondaryConstructorDeclaration;
import com.ktast.ast.decl.TypeAliasDeclaration;
import com.ktast.ast.decl.TypeParam;
import com.ktast.ast.decl.TypeParams;
import com.ktast.ast.decl.Variable;
import com.ktast.ast.expr.AnnotatedExpression;
import com.ktast.ast.expr.AnonymousFunctionExpression;
import com.ktast.ast.expr.ArrayAccessExpression;
import com.ktast.ast.expr.BinaryExpression;
import com.ktast.ast.expr.BinaryInfixExpression;
import com.ktast.ast.expr.BinaryTypeExpression;
import com.ktast.ast.expr.BlockExpression;
import com.ktast.ast.expr.BreakExpression;
import com.ktast.ast.expr.CallExpression;
import com.ktast.ast.expr.CallableReferenceExpression;
import com.ktast.ast.expr.ClassLiteralExpression;
import com.ktast.ast.expr.CollectionLiteralExpression;
import com.ktast.ast.expr.ConstantLiteralExpression;
import com.ktast.ast.expr.ContinueExpression;
import com.ktast.ast.expr.DoWhileExpression;
import com.ktast.ast.expr.ForExpression;
import com.ktast.ast.expr.IfExpression;
import com.ktast.ast.expr.LabeledExpression;
import com.ktast.ast.expr.LambdaExpression;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.expr.ObjectLiteralExpression;
import com.ktast.ast.expr.ParenthesizedExpression;
import com.ktast.ast.expr.PostfixUnaryExpression;
import com.ktast.ast.expr.PrefixUnaryExpression;
import com.ktast.ast.expr.ReturnExpression;
import com.ktast.ast.expr.StringLiteralExpression;
import com.ktast.ast.expr.SuperExpression;
import com.ktast.ast.expr.ThisExpression;
import com.ktast.ast.expr.ThrowExpression;
import com.ktast.ast.expr.TryExpression;
import com.ktast.ast.expr.ValueArg;
import com.ktast.ast.expr.ValueArgs;
import com.ktast.ast.expr.WhenExpression;
import com.ktast.ast.expr.WhileExpression;
import com.ktast.ast.extra.BlankLines;
import com.ktast.ast.extra.Comment;
import com.ktast.ast.extra.Semicolon;
import com.ktast.ast.extra.TrailingComma;
import com.ktast.ast.extra.Whitespace;
import com.ktast.ast.modifier.Annotation;
import com.ktast.ast.modifier.AnnotationSet;
import com.ktast.ast.modifier.Contract;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.Modifiers;
import com.ktast.ast.modifier.TypeConstraintSet;
import com.ktast.ast.type.DynamicType;
import com.ktast.ast.type.FunctionType;
import com.ktast.ast.type.NullableType;
import com.ktast.ast.type.SimpleType;
import com.ktast.ast.type.TypeArg;
import com.ktast.ast.type.TypeArgs;
import com.ktast.ast.type.TypeRef;

/**
 * 节点访问者：每种节点一个方法
 *
 * <p>方法全部为抽象方法，新增节点种类时所有分派点（Visitor、MutableVisitor、Writer）都会编译失败，
 * 从而保证分派的完整性。</p>
 *
 * @param <R> 返回值类型
 * @param <C> 上下文类型
 */
public interface NodeVisitor<R, C> {

    // ============ 声明 ============

    R visitClassDeclaration(ClassDeclaration node, C context);

    R visitPrimaryConstructor(ClassDeclaration.PrimaryConstructor node, C context);

    R visitClassParents(ClassDeclaration.ClassParents node, C context);

    R visitCallConstructorParent(ClassDeclaration.CallConstructorParent node, C context);

    R visitDelegationParent(ClassDeclaration.DelegationParent node, C context);

    R visitTypeParent(ClassDeclaration.TypeParent node, C context);

    R visitClassBody(ClassDeclaration.ClassBody node, C context);

    R visitEnumEntry(ClassDeclaration.EnumEntry node, C context);

    R visitFunctionDeclaration(FunctionDeclaration node, C context);

    R visitFunctionParam(FunctionParam node, C context);

    R visitFunctionParams(FunctionParams node, C context);

    R visitImportDirective(ImportDirective node, C context);

    R visitImportAlias(ImportDirective.ImportAlias node, C context);

    R visitInitDeclaration(InitDeclaration node, C context);

    R visitKotlinFile(KotlinFile node, C context);

    R visitKotlinScript(KotlinScript node, C context);

    R visitPackageDirective(PackageDirective node, C context);

    R visitPropertyDeclaration(PropertyDeclaration node, C context);

    R visitPropertyDelegate(PropertyDeclaration.PropertyDelegate node, C context);

    R visitGetter(PropertyDeclaration.Getter node, C context);

    R visitSetter(PropertyDeclaration.Setter node, C context);

    R visitSecondaryConstructorDeclaration(SecondaryConstructorDeclaration node, C context);

    R visitDelegationCall(SecondaryConstructorDeclaration.DelegationCall node, C context);

    R visitTypeAliasDeclaration(TypeAliasDeclaration node, C context);

    R visitTypeParam(TypeParam node, C context);

    R visitTypeParams(TypeParams node, C context);

    R visitVariable(Variable node, C context);


    // ============ 表达式 ============

    R visitAnnotatedExpression(AnnotatedExpression node, C context);

    R visitAnonymousFunctionExpression(AnonymousFunctionExpression node, C context);

    R visitArrayAccessExpression(ArrayAccessExpression node, C context);

    R visitBinaryExpression(BinaryExpression node, C context);

    R visitBinaryInfixExpression(BinaryInfixExpression node, C context);

    R visitBinaryTypeExpression(BinaryTypeExpression node, C context);

    R visitBlockExpression(BlockExpression node, C context);

    R visitBreakExpression(BreakExpression node, C context);

    R visitCallExpression(CallExpression node, C context);

    R visitLambdaArg(CallExpression.LambdaArg node, C context);

    R visitCallableReferenceExpression(CallableReferenceExpression node, C context);

    R visitClassLiteralExpression(ClassLiteralExpression node, C context);

    R visitCollectionLiteralExpression(CollectionLiteralExpression node, C context);

    R visitConstantLiteralExpression(ConstantLiteralExpression node, C context);

    R visitContinueExpression(ContinueExpression node, C context);

    R visitDoWhileExpression(DoWhileExpression node, C context);

    R visitForExpression(ForExpression node, C context);

    R visitIfExpression(IfExpression node, C context);

    R visitLabeledExpression(LabeledExpression node, C context);

    R visitLambdaExpression(LambdaExpression node, C context);

    R visitLambdaParams(LambdaExpression.LambdaParams node, C context);

    R visitLambdaParam(LambdaExpression.LambdaParam node, C context);

    R visitLambdaBody(LambdaExpression.LambdaBody node, C context);

    R visitNameExpression(NameExpression node, C context);

    R visitObjectLiteralExpression(ObjectLiteralExpression node, C context);

    R visitParenthesizedExpression(ParenthesizedExpression node, C context);

    R visitPostfixUnaryExpression(PostfixUnaryExpression node, C context);

    R visitPrefixUnaryExpression(PrefixUnaryExpression node, C context);

    R visitReturnExpression(ReturnExpression node, C context);

    R visitStringLiteralExpression(StringLiteralExpression node, C context);

    R visitLiteralStringEntry(StringLiteralExpression.LiteralStringEntry node, C context);

    R visitEscapeStringEntry(StringLiteralExpression.EscapeStringEntry node, C context);

    R visitTemplateStringEntry(StringLiteralExpression.TemplateStringEntry node, C context);

    R visitSuperExpression(SuperExpression node, C context);

    R visitThisExpression(ThisExpression node, C context);

    R visitThrowExpression(ThrowExpression node, C context);

    R visitTryExpression(TryExpression node, C context);

    R visitCatchClause(TryExpression.CatchClause node, C context);

    R visitValueArg(ValueArg node, C context);

    R visitValueArgs(ValueArgs node, C context);

    R visitWhenExpression(WhenExpression node, C context);

    R visitWhenBranch(WhenExpression.WhenBranch node, C context);

    R visitWhenCondition(WhenExpression.WhenCondition node, C context);

    R visitWhileExpression(WhileExpression node, C context);


    // ============ 类型 ============

    R visitDynamicType(DynamicType node, C context);

    R visitFunctionType(FunctionType node, C context);

    R visitFunctionTypeReceiver(FunctionType.Receiver node, C context);

    R visitFunctionTypeParams(FunctionType.Params node, C context);

    R visitFunctionTypeParam(FunctionType.Param node, C context);

    R visitNullableType(NullableType node, C context);

    R visitSimpleType(SimpleType node, C context);

    R visitSimpleTypeQualifier(SimpleType.Qualifier node, C context);

    R visitTypeArg(TypeArg node, C context);

    R visitTypeArgs(TypeArgs node, C context);

    R visitTypeRef(TypeRef node, C context);


    // ============ 修饰符 ============

    R visitAnnotation(Annotation node, C context);

    R visitAnnotationSet(AnnotationSet node, C context);

    R visitContract(Contract node, C context);

    R visitContractEffects(Contract.ContractEffects node, C context);

    R visitContractEffect(Contract.ContractEffect node, C context);

    R visitKeyword(Keyword node, C context);

    R visitModifiers(Modifiers node, C context);

    R visitTypeConstraintSet(TypeConstraintSet node, C context);

    R visitTypeConstraints(TypeConstraintSet.TypeConstraints node, C context);

    R visitTypeConstraint(TypeConstraintSet.TypeConstraint node, C context);


    // ============ 附加信息 ============

    R visitBlankLines(BlankLines node, C context);

    R visitComment(Comment node, C context);

    R visitSemicolon(Semicolon node, C context);

    R visitTrailingComma(TrailingComma node, C context);

    R visitWhitespace(Whitespace node, C context);
}
