package org.javai.cst.visit;

import java.util.IdentityHashMap;
import java.util.Map;
import org.javai.cst.nodes.AnnAssign;
import org.javai.cst.nodes.Annotation;
import org.javai.cst.nodes.Arg;
import org.javai.cst.nodes.AsName;
import org.javai.cst.nodes.Assert;
import org.javai.cst.nodes.Assign;
import org.javai.cst.nodes.AssignEqual;
import org.javai.cst.nodes.AssignTarget;
import org.javai.cst.nodes.Asynchronous;
import org.javai.cst.nodes.Attribute;
import org.javai.cst.nodes.AugAssign;
import org.javai.cst.nodes.AugOp;
import org.javai.cst.nodes.Await;
import org.javai.cst.nodes.BinaryOp;
import org.javai.cst.nodes.BinaryOperation;
import org.javai.cst.nodes.BooleanOp;
import org.javai.cst.nodes.BooleanOperation;
import org.javai.cst.nodes.Break;
import org.javai.cst.nodes.Call;
import org.javai.cst.nodes.ClassDef;
import org.javai.cst.nodes.Colon;
import org.javai.cst.nodes.Comma;
import org.javai.cst.nodes.Comment;
import org.javai.cst.nodes.CompFor;
import org.javai.cst.nodes.CompIf;
import org.javai.cst.nodes.CompOp;
import org.javai.cst.nodes.Comparison;
import org.javai.cst.nodes.ComparisonTarget;
import org.javai.cst.nodes.ConcatenatedString;
import org.javai.cst.nodes.Continue;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.Decorator;
import org.javai.cst.nodes.Del;
import org.javai.cst.nodes.DictComp;
import org.javai.cst.nodes.DictElement;
import org.javai.cst.nodes.DictExpr;
import org.javai.cst.nodes.Dot;
import org.javai.cst.nodes.Element;
import org.javai.cst.nodes.Elif;
import org.javai.cst.nodes.Ellipsis;
import org.javai.cst.nodes.Else;
import org.javai.cst.nodes.EmptyLine;
import org.javai.cst.nodes.ExceptHandler;
import org.javai.cst.nodes.Expr;
import org.javai.cst.nodes.Finally;
import org.javai.cst.nodes.FloatLiteral;
import org.javai.cst.nodes.For;
import org.javai.cst.nodes.From;
import org.javai.cst.nodes.FunctionDef;
import org.javai.cst.nodes.GeneratorExp;
import org.javai.cst.nodes.Global;
import org.javai.cst.nodes.If;
import org.javai.cst.nodes.IfExp;
import org.javai.cst.nodes.ImaginaryLiteral;
import org.javai.cst.nodes.Import;
import org.javai.cst.nodes.ImportAlias;
import org.javai.cst.nodes.ImportFrom;
import org.javai.cst.nodes.ImportStar;
import org.javai.cst.nodes.IndentedBlock;
import org.javai.cst.nodes.Index;
import org.javai.cst.nodes.IntegerLiteral;
import org.javai.cst.nodes.Lambda;
import org.javai.cst.nodes.LeftCurlyBrace;
import org.javai.cst.nodes.LeftParen;
import org.javai.cst.nodes.LeftSquareBracket;
import org.javai.cst.nodes.ListComp;
import org.javai.cst.nodes.ListExpr;
import org.javai.cst.nodes.Module;
import org.javai.cst.nodes.Name;
import org.javai.cst.nodes.NameItem;
import org.javai.cst.nodes.NamedExpr;
import org.javai.cst.nodes.Newline;
import org.javai.cst.nodes.Nonlocal;
import org.javai.cst.nodes.Param;
import org.javai.cst.nodes.ParamSlash;
import org.javai.cst.nodes.ParamStar;
import org.javai.cst.nodes.Parameters;
import org.javai.cst.nodes.ParenthesizedWhitespace;
import org.javai.cst.nodes.Pass;
import org.javai.cst.nodes.Raise;
import org.javai.cst.nodes.Return;
import org.javai.cst.nodes.RightCurlyBrace;
import org.javai.cst.nodes.RightParen;
import org.javai.cst.nodes.RightSquareBracket;
import org.javai.cst.nodes.Semicolon;
import org.javai.cst.nodes.SetComp;
import org.javai.cst.nodes.SetExpr;
import org.javai.cst.nodes.SimpleStatementLine;
import org.javai.cst.nodes.SimpleStatementSuite;
import org.javai.cst.nodes.SimpleString;
import org.javai.cst.nodes.SimpleWhitespace;
import org.javai.cst.nodes.Slice;
import org.javai.cst.nodes.StarredDictElement;
import org.javai.cst.nodes.StarredElement;
import org.javai.cst.nodes.Subscript;
import org.javai.cst.nodes.SubscriptElement;
import org.javai.cst.nodes.TrailingWhitespace;
import org.javai.cst.nodes.Try;
import org.javai.cst.nodes.TupleExpr;
import org.javai.cst.nodes.UnaryOp;
import org.javai.cst.nodes.UnaryOperation;
import org.javai.cst.nodes.While;
import org.javai.cst.nodes.With;
import org.javai.cst.nodes.WithItem;
import org.javai.cst.nodes.Yield;

/**
 * Routes the generic hooks to the typed ones, keyed by the exact node class.
 */
final class NodeDispatch {

	@FunctionalInterface
	private interface VisitHook<T extends CstNode> {
		boolean visit(CstTraversal traversal, T node);
	}

	@FunctionalInterface
	private interface LeaveHook<T extends CstNode> {
		void leave(CstVisitor visitor, T node);
	}

	@FunctionalInterface
	private interface TransformHook<T extends CstNode> {
		Replacement leave(CstTransformer transformer, T original, T updated);
	}

	private record Hooks<T extends CstNode>(Class<T> type, VisitHook<T> visit, LeaveHook<T> leave,
			TransformHook<T> transform) {
	}

	private static final Map<Class<?>, Hooks<?>> HOOKS = new IdentityHashMap<>();

	static {
		register(AnnAssign.class, CstTraversal::visitAnnAssign, CstVisitor::leaveAnnAssign, CstTransformer::leaveAnnAssign);
		register(Annotation.class, CstTraversal::visitAnnotation, CstVisitor::leaveAnnotation, CstTransformer::leaveAnnotation);
		register(Arg.class, CstTraversal::visitArg, CstVisitor::leaveArg, CstTransformer::leaveArg);
		register(AsName.class, CstTraversal::visitAsName, CstVisitor::leaveAsName, CstTransformer::leaveAsName);
		register(Assert.class, CstTraversal::visitAssert, CstVisitor::leaveAssert, CstTransformer::leaveAssert);
		register(Assign.class, CstTraversal::visitAssign, CstVisitor::leaveAssign, CstTransformer::leaveAssign);
		register(AssignEqual.class, CstTraversal::visitAssignEqual, CstVisitor::leaveAssignEqual, CstTransformer::leaveAssignEqual);
		register(AssignTarget.class, CstTraversal::visitAssignTarget, CstVisitor::leaveAssignTarget, CstTransformer::leaveAssignTarget);
		register(Asynchronous.class, CstTraversal::visitAsynchronous, CstVisitor::leaveAsynchronous, CstTransformer::leaveAsynchronous);
		register(Attribute.class, CstTraversal::visitAttribute, CstVisitor::leaveAttribute, CstTransformer::leaveAttribute);
		register(AugAssign.class, CstTraversal::visitAugAssign, CstVisitor::leaveAugAssign, CstTransformer::leaveAugAssign);
		register(AugOp.class, CstTraversal::visitAugOp, CstVisitor::leaveAugOp, CstTransformer::leaveAugOp);
		register(Await.class, CstTraversal::visitAwait, CstVisitor::leaveAwait, CstTransformer::leaveAwait);
		register(BinaryOp.class, CstTraversal::visitBinaryOp, CstVisitor::leaveBinaryOp, CstTransformer::leaveBinaryOp);
		register(BinaryOperation.class, CstTraversal::visitBinaryOperation, CstVisitor::leaveBinaryOperation, CstTransformer::leaveBinaryOperation);
		register(BooleanOp.class, CstTraversal::visitBooleanOp, CstVisitor::leaveBooleanOp, CstTransformer::leaveBooleanOp);
		register(BooleanOperation.class, CstTraversal::visitBooleanOperation, CstVisitor::leaveBooleanOperation, CstTransformer::leaveBooleanOperation);
		register(Break.class, CstTraversal::visitBreak, CstVisitor::leaveBreak, CstTransformer::leaveBreak);
		register(Call.class, CstTraversal::visitCall, CstVisitor::leaveCall, CstTransformer::leaveCall);
		register(ClassDef.class, CstTraversal::visitClassDef, CstVisitor::leaveClassDef, CstTransformer::leaveClassDef);
		register(Colon.class, CstTraversal::visitColon, CstVisitor::leaveColon, CstTransformer::leaveColon);
		register(Comma.class, CstTraversal::visitComma, CstVisitor::leaveComma, CstTransformer::leaveComma);
		register(Comment.class, CstTraversal::visitComment, CstVisitor::leaveComment, CstTransformer::leaveComment);
		register(CompFor.class, CstTraversal::visitCompFor, CstVisitor::leaveCompFor, CstTransformer::leaveCompFor);
		register(CompIf.class, CstTraversal::visitCompIf, CstVisitor::leaveCompIf, CstTransformer::leaveCompIf);
		register(CompOp.class, CstTraversal::visitCompOp, CstVisitor::leaveCompOp, CstTransformer::leaveCompOp);
		register(Comparison.class, CstTraversal::visitComparison, CstVisitor::leaveComparison, CstTransformer::leaveComparison);
		register(ComparisonTarget.class, CstTraversal::visitComparisonTarget, CstVisitor::leaveComparisonTarget, CstTransformer::leaveComparisonTarget);
		register(ConcatenatedString.class, CstTraversal::visitConcatenatedString, CstVisitor::leaveConcatenatedString, CstTransformer::leaveConcatenatedString);
		register(Continue.class, CstTraversal::visitContinue, CstVisitor::leaveContinue, CstTransformer::leaveContinue);
		register(Decorator.class, CstTraversal::visitDecorator, CstVisitor::leaveDecorator, CstTransformer::leaveDecorator);
		register(Del.class, CstTraversal::visitDel, CstVisitor::leaveDel, CstTransformer::leaveDel);
		register(DictComp.class, CstTraversal::visitDictComp, CstVisitor::leaveDictComp, CstTransformer::leaveDictComp);
		register(DictElement.class, CstTraversal::visitDictElement, CstVisitor::leaveDictElement, CstTransformer::leaveDictElement);
		register(DictExpr.class, CstTraversal::visitDictExpr, CstVisitor::leaveDictExpr, CstTransformer::leaveDictExpr);
		register(Dot.class, CstTraversal::visitDot, CstVisitor::leaveDot, CstTransformer::leaveDot);
		register(Element.class, CstTraversal::visitElement, CstVisitor::leaveElement, CstTransformer::leaveElement);
		register(Elif.class, CstTraversal::visitElif, CstVisitor::leaveElif, CstTransformer::leaveElif);
		register(Ellipsis.class, CstTraversal::visitEllipsis, CstVisitor::leaveEllipsis, CstTransformer::leaveEllipsis);
		register(Else.class, CstTraversal::visitElse, CstVisitor::leaveElse, CstTransformer::leaveElse);
		register(EmptyLine.class, CstTraversal::visitEmptyLine, CstVisitor::leaveEmptyLine, CstTransformer::leaveEmptyLine);
		register(ExceptHandler.class, CstTraversal::visitExceptHandler, CstVisitor::leaveExceptHandler, CstTransformer::leaveExceptHandler);
		register(Expr.class, CstTraversal::visitExpr, CstVisitor::leaveExpr, CstTransformer::leaveExpr);
		register(Finally.class, CstTraversal::visitFinally, CstVisitor::leaveFinally, CstTransformer::leaveFinally);
		register(FloatLiteral.class, CstTraversal::visitFloatLiteral, CstVisitor::leaveFloatLiteral, CstTransformer::leaveFloatLiteral);
		register(For.class, CstTraversal::visitFor, CstVisitor::leaveFor, CstTransformer::leaveFor);
		register(From.class, CstTraversal::visitFrom, CstVisitor::leaveFrom, CstTransformer::leaveFrom);
		register(FunctionDef.class, CstTraversal::visitFunctionDef, CstVisitor::leaveFunctionDef, CstTransformer::leaveFunctionDef);
		register(GeneratorExp.class, CstTraversal::visitGeneratorExp, CstVisitor::leaveGeneratorExp, CstTransformer::leaveGeneratorExp);
		register(Global.class, CstTraversal::visitGlobal, CstVisitor::leaveGlobal, CstTransformer::leaveGlobal);
		register(If.class, CstTraversal::visitIf, CstVisitor::leaveIf, CstTransformer::leaveIf);
		register(IfExp.class, CstTraversal::visitIfExp, CstVisitor::leaveIfExp, CstTransformer::leaveIfExp);
		register(ImaginaryLiteral.class, CstTraversal::visitImaginaryLiteral, CstVisitor::leaveImaginaryLiteral, CstTransformer::leaveImaginaryLiteral);
		register(Import.class, CstTraversal::visitImport, CstVisitor::leaveImport, CstTransformer::leaveImport);
		register(ImportAlias.class, CstTraversal::visitImportAlias, CstVisitor::leaveImportAlias, CstTransformer::leaveImportAlias);
		register(ImportFrom.class, CstTraversal::visitImportFrom, CstVisitor::leaveImportFrom, CstTransformer::leaveImportFrom);
		register(ImportStar.class, CstTraversal::visitImportStar, CstVisitor::leaveImportStar, CstTransformer::leaveImportStar);
		register(IndentedBlock.class, CstTraversal::visitIndentedBlock, CstVisitor::leaveIndentedBlock, CstTransformer::leaveIndentedBlock);
		register(Index.class, CstTraversal::visitIndex, CstVisitor::leaveIndex, CstTransformer::leaveIndex);
		register(IntegerLiteral.class, CstTraversal::visitIntegerLiteral, CstVisitor::leaveIntegerLiteral, CstTransformer::leaveIntegerLiteral);
		register(Lambda.class, CstTraversal::visitLambda, CstVisitor::leaveLambda, CstTransformer::leaveLambda);
		register(LeftCurlyBrace.class, CstTraversal::visitLeftCurlyBrace, CstVisitor::leaveLeftCurlyBrace, CstTransformer::leaveLeftCurlyBrace);
		register(LeftParen.class, CstTraversal::visitLeftParen, CstVisitor::leaveLeftParen, CstTransformer::leaveLeftParen);
		register(LeftSquareBracket.class, CstTraversal::visitLeftSquareBracket, CstVisitor::leaveLeftSquareBracket, CstTransformer::leaveLeftSquareBracket);
		register(ListComp.class, CstTraversal::visitListComp, CstVisitor::leaveListComp, CstTransformer::leaveListComp);
		register(ListExpr.class, CstTraversal::visitListExpr, CstVisitor::leaveListExpr, CstTransformer::leaveListExpr);
		register(Module.class, CstTraversal::visitModule, CstVisitor::leaveModule, CstTransformer::leaveModule);
		register(Name.class, CstTraversal::visitName, CstVisitor::leaveName, CstTransformer::leaveName);
		register(NameItem.class, CstTraversal::visitNameItem, CstVisitor::leaveNameItem, CstTransformer::leaveNameItem);
		register(NamedExpr.class, CstTraversal::visitNamedExpr, CstVisitor::leaveNamedExpr, CstTransformer::leaveNamedExpr);
		register(Newline.class, CstTraversal::visitNewline, CstVisitor::leaveNewline, CstTransformer::leaveNewline);
		register(Nonlocal.class, CstTraversal::visitNonlocal, CstVisitor::leaveNonlocal, CstTransformer::leaveNonlocal);
		register(Param.class, CstTraversal::visitParam, CstVisitor::leaveParam, CstTransformer::leaveParam);
		register(ParamSlash.class, CstTraversal::visitParamSlash, CstVisitor::leaveParamSlash, CstTransformer::leaveParamSlash);
		register(ParamStar.class, CstTraversal::visitParamStar, CstVisitor::leaveParamStar, CstTransformer::leaveParamStar);
		register(Parameters.class, CstTraversal::visitParameters, CstVisitor::leaveParameters, CstTransformer::leaveParameters);
		register(ParenthesizedWhitespace.class, CstTraversal::visitParenthesizedWhitespace, CstVisitor::leaveParenthesizedWhitespace, CstTransformer::leaveParenthesizedWhitespace);
		register(Pass.class, CstTraversal::visitPass, CstVisitor::leavePass, CstTransformer::leavePass);
		register(Raise.class, CstTraversal::visitRaise, CstVisitor::leaveRaise, CstTransformer::leaveRaise);
		register(Return.class, CstTraversal::visitReturn, CstVisitor::leaveReturn, CstTransformer::leaveReturn);
		register(RightCurlyBrace.class, CstTraversal::visitRightCurlyBrace, CstVisitor::leaveRightCurlyBrace, CstTransformer::leaveRightCurlyBrace);
		register(RightParen.class, CstTraversal::visitRightParen, CstVisitor::leaveRightParen, CstTransformer::leaveRightParen);
		register(RightSquareBracket.class, CstTraversal::visitRightSquareBracket, CstVisitor::leaveRightSquareBracket, CstTransformer::leaveRightSquareBracket);
		register(Semicolon.class, CstTraversal::visitSemicolon, CstVisitor::leaveSemicolon, CstTransformer::leaveSemicolon);
		register(SetComp.class, CstTraversal::visitSetComp, CstVisitor::leaveSetComp, CstTransformer::leaveSetComp);
		register(SetExpr.class, CstTraversal::visitSetExpr, CstVisitor::leaveSetExpr, CstTransformer::leaveSetExpr);
		register(SimpleStatementLine.class, CstTraversal::visitSimpleStatementLine, CstVisitor::leaveSimpleStatementLine, CstTransformer::leaveSimpleStatementLine);
		register(SimpleStatementSuite.class, CstTraversal::visitSimpleStatementSuite, CstVisitor::leaveSimpleStatementSuite, CstTransformer::leaveSimpleStatementSuite);
		register(SimpleString.class, CstTraversal::visitSimpleString, CstVisitor::leaveSimpleString, CstTransformer::leaveSimpleString);
		register(SimpleWhitespace.class, CstTraversal::visitSimpleWhitespace, CstVisitor::leaveSimpleWhitespace, CstTransformer::leaveSimpleWhitespace);
		register(Slice.class, CstTraversal::visitSlice, CstVisitor::leaveSlice, CstTransformer::leaveSlice);
		register(StarredDictElement.class, CstTraversal::visitStarredDictElement, CstVisitor::leaveStarredDictElement, CstTransformer::leaveStarredDictElement);
		register(StarredElement.class, CstTraversal::visitStarredElement, CstVisitor::leaveStarredElement, CstTransformer::leaveStarredElement);
		register(Subscript.class, CstTraversal::visitSubscript, CstVisitor::leaveSubscript, CstTransformer::leaveSubscript);
		register(SubscriptElement.class, CstTraversal::visitSubscriptElement, CstVisitor::leaveSubscriptElement, CstTransformer::leaveSubscriptElement);
		register(TrailingWhitespace.class, CstTraversal::visitTrailingWhitespace, CstVisitor::leaveTrailingWhitespace, CstTransformer::leaveTrailingWhitespace);
		register(Try.class, CstTraversal::visitTry, CstVisitor::leaveTry, CstTransformer::leaveTry);
		register(TupleExpr.class, CstTraversal::visitTupleExpr, CstVisitor::leaveTupleExpr, CstTransformer::leaveTupleExpr);
		register(UnaryOp.class, CstTraversal::visitUnaryOp, CstVisitor::leaveUnaryOp, CstTransformer::leaveUnaryOp);
		register(UnaryOperation.class, CstTraversal::visitUnaryOperation, CstVisitor::leaveUnaryOperation, CstTransformer::leaveUnaryOperation);
		register(While.class, CstTraversal::visitWhile, CstVisitor::leaveWhile, CstTransformer::leaveWhile);
		register(With.class, CstTraversal::visitWith, CstVisitor::leaveWith, CstTransformer::leaveWith);
		register(WithItem.class, CstTraversal::visitWithItem, CstVisitor::leaveWithItem, CstTransformer::leaveWithItem);
		register(Yield.class, CstTraversal::visitYield, CstVisitor::leaveYield, CstTransformer::leaveYield);
	}

	private NodeDispatch() {
	}

	private static <T extends CstNode> void register(Class<T> type, VisitHook<T> visit, LeaveHook<T> leave,
			TransformHook<T> transform) {
		HOOKS.put(type, new Hooks<>(type, visit, leave, transform));
	}

	static boolean visit(CstTraversal traversal, CstNode node) {
		return visit(hooks(node), traversal, node);
	}

	static void leave(CstVisitor visitor, CstNode node) {
		leave(hooks(node), visitor, node);
	}

	static Replacement transform(CstTransformer transformer, CstNode original, CstNode updated) {
		return transform(hooks(original), transformer, original, updated);
	}

	private static <T extends CstNode> boolean visit(Hooks<T> hooks, CstTraversal traversal, CstNode node) {
		return hooks.visit().visit(traversal, hooks.type().cast(node));
	}

	private static <T extends CstNode> void leave(Hooks<T> hooks, CstVisitor visitor, CstNode node) {
		hooks.leave().leave(visitor, hooks.type().cast(node));
	}

	private static <T extends CstNode> Replacement transform(Hooks<T> hooks, CstTransformer transformer,
			CstNode original, CstNode updated) {
		return hooks.transform().leave(transformer, hooks.type().cast(original), hooks.type().cast(updated));
	}

	private static Hooks<?> hooks(CstNode node) {
		Hooks<?> hooks = HOOKS.get(node.getClass());
		if (hooks == null) {
			throw new IllegalArgumentException("No hooks for node type " + node.getClass().getName());
		}
		return hooks;
	}
}
