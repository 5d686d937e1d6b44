package org.javai.cst.visit;

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
 * Shared base of {@link CstVisitor} and {@link CstTransformer}.
 * <p>
 * The walker calls {@link #onVisit(CstNode)} before descending into a node.
 * By default it dispatches to the {@code visitX} hook for the node's type;
 * returning {@code false} skips the node's children. The leave side lives in
 * the subclasses because visitors and transformers leave nodes differently.
 * <p>
 * An instance serves one traversal at a time. The {@link TraversalScope} of
 * the running traversal is available through {@link #scope()}.
 */
public abstract class CstTraversal {

	private TraversalScope scope;

	/**
	 * Called before the children of {@code node} are visited.
	 *
	 * @return whether to visit the children
	 */
	public boolean onVisit(CstNode node) {
		return NodeDispatch.visit(this, node);
	}

	/**
	 * The scope of the traversal in progress.
	 *
	 * @throws IllegalStateException outside a traversal
	 */
	protected TraversalScope scope() {
		if (scope == null) {
			throw new IllegalStateException("No traversal in progress");
		}
		return scope;
	}

	final TraversalScope begin() {
		if (scope != null) {
			throw new IllegalStateException(getClass().getSimpleName() + " is already running a traversal");
		}
		scope = new TraversalScope();
		return scope;
	}

	final void end() {
		scope = null;
	}

	public boolean visitAnnAssign(AnnAssign node) {
		return true;
	}

	public boolean visitAnnotation(Annotation node) {
		return true;
	}

	public boolean visitArg(Arg node) {
		return true;
	}

	public boolean visitAsName(AsName node) {
		return true;
	}

	public boolean visitAssert(Assert node) {
		return true;
	}

	public boolean visitAssign(Assign node) {
		return true;
	}

	public boolean visitAssignEqual(AssignEqual node) {
		return true;
	}

	public boolean visitAssignTarget(AssignTarget node) {
		return true;
	}

	public boolean visitAsynchronous(Asynchronous node) {
		return true;
	}

	public boolean visitAttribute(Attribute node) {
		return true;
	}

	public boolean visitAugAssign(AugAssign node) {
		return true;
	}

	public boolean visitAugOp(AugOp node) {
		return true;
	}

	public boolean visitAwait(Await node) {
		return true;
	}

	public boolean visitBinaryOp(BinaryOp node) {
		return true;
	}

	public boolean visitBinaryOperation(BinaryOperation node) {
		return true;
	}

	public boolean visitBooleanOp(BooleanOp node) {
		return true;
	}

	public boolean visitBooleanOperation(BooleanOperation node) {
		return true;
	}

	public boolean visitBreak(Break node) {
		return true;
	}

	public boolean visitCall(Call node) {
		return true;
	}

	public boolean visitClassDef(ClassDef node) {
		return true;
	}

	public boolean visitColon(Colon node) {
		return true;
	}

	public boolean visitComma(Comma node) {
		return true;
	}

	public boolean visitComment(Comment node) {
		return true;
	}

	public boolean visitCompFor(CompFor node) {
		return true;
	}

	public boolean visitCompIf(CompIf node) {
		return true;
	}

	public boolean visitCompOp(CompOp node) {
		return true;
	}

	public boolean visitComparison(Comparison node) {
		return true;
	}

	public boolean visitComparisonTarget(ComparisonTarget node) {
		return true;
	}

	public boolean visitConcatenatedString(ConcatenatedString node) {
		return true;
	}

	public boolean visitContinue(Continue node) {
		return true;
	}

	public boolean visitDecorator(Decorator node) {
		return true;
	}

	public boolean visitDel(Del node) {
		return true;
	}

	public boolean visitDictComp(DictComp node) {
		return true;
	}

	public boolean visitDictElement(DictElement node) {
		return true;
	}

	public boolean visitDictExpr(DictExpr node) {
		return true;
	}

	public boolean visitDot(Dot node) {
		return true;
	}

	public boolean visitElement(Element node) {
		return true;
	}

	public boolean visitElif(Elif node) {
		return true;
	}

	public boolean visitEllipsis(Ellipsis node) {
		return true;
	}

	public boolean visitElse(Else node) {
		return true;
	}

	public boolean visitEmptyLine(EmptyLine node) {
		return true;
	}

	public boolean visitExceptHandler(ExceptHandler node) {
		return true;
	}

	public boolean visitExpr(Expr node) {
		return true;
	}

	public boolean visitFinally(Finally node) {
		return true;
	}

	public boolean visitFloatLiteral(FloatLiteral node) {
		return true;
	}

	public boolean visitFor(For node) {
		return true;
	}

	public boolean visitFrom(From node) {
		return true;
	}

	public boolean visitFunctionDef(FunctionDef node) {
		return true;
	}

	public boolean visitGeneratorExp(GeneratorExp node) {
		return true;
	}

	public boolean visitGlobal(Global node) {
		return true;
	}

	public boolean visitIf(If node) {
		return true;
	}

	public boolean visitIfExp(IfExp node) {
		return true;
	}

	public boolean visitImaginaryLiteral(ImaginaryLiteral node) {
		return true;
	}

	public boolean visitImport(Import node) {
		return true;
	}

	public boolean visitImportAlias(ImportAlias node) {
		return true;
	}

	public boolean visitImportFrom(ImportFrom node) {
		return true;
	}

	public boolean visitImportStar(ImportStar node) {
		return true;
	}

	public boolean visitIndentedBlock(IndentedBlock node) {
		return true;
	}

	public boolean visitIndex(Index node) {
		return true;
	}

	public boolean visitIntegerLiteral(IntegerLiteral node) {
		return true;
	}

	public boolean visitLambda(Lambda node) {
		return true;
	}

	public boolean visitLeftCurlyBrace(LeftCurlyBrace node) {
		return true;
	}

	public boolean visitLeftParen(LeftParen node) {
		return true;
	}

	public boolean visitLeftSquareBracket(LeftSquareBracket node) {
		return true;
	}

	public boolean visitListComp(ListComp node) {
		return true;
	}

	public boolean visitListExpr(ListExpr node) {
		return true;
	}

	public boolean visitModule(Module node) {
		return true;
	}

	public boolean visitName(Name node) {
		return true;
	}

	public boolean visitNameItem(NameItem node) {
		return true;
	}

	public boolean visitNamedExpr(NamedExpr node) {
		return true;
	}

	public boolean visitNewline(Newline node) {
		return true;
	}

	public boolean visitNonlocal(Nonlocal node) {
		return true;
	}

	public boolean visitParam(Param node) {
		return true;
	}

	public boolean visitParamSlash(ParamSlash node) {
		return true;
	}

	public boolean visitParamStar(ParamStar node) {
		return true;
	}

	public boolean visitParameters(Parameters node) {
		return true;
	}

	public boolean visitParenthesizedWhitespace(ParenthesizedWhitespace node) {
		return true;
	}

	public boolean visitPass(Pass node) {
		return true;
	}

	public boolean visitRaise(Raise node) {
		return true;
	}

	public boolean visitReturn(Return node) {
		return true;
	}

	public boolean visitRightCurlyBrace(RightCurlyBrace node) {
		return true;
	}

	public boolean visitRightParen(RightParen node) {
		return true;
	}

	public boolean visitRightSquareBracket(RightSquareBracket node) {
		return true;
	}

	public boolean visitSemicolon(Semicolon node) {
		return true;
	}

	public boolean visitSetComp(SetComp node) {
		return true;
	}

	public boolean visitSetExpr(SetExpr node) {
		return true;
	}

	public boolean visitSimpleStatementLine(SimpleStatementLine node) {
		return true;
	}

	public boolean visitSimpleStatementSuite(SimpleStatementSuite node) {
		return true;
	}

	public boolean visitSimpleString(SimpleString node) {
		return true;
	}

	public boolean visitSimpleWhitespace(SimpleWhitespace node) {
		return true;
	}

	public boolean visitSlice(Slice node) {
		return true;
	}

	public boolean visitStarredDictElement(StarredDictElement node) {
		return true;
	}

	public boolean visitStarredElement(StarredElement node) {
		return true;
	}

	public boolean visitSubscript(Subscript node) {
		return true;
	}

	public boolean visitSubscriptElement(SubscriptElement node) {
		return true;
	}

	public boolean visitTrailingWhitespace(TrailingWhitespace node) {
		return true;
	}

	public boolean visitTry(Try node) {
		return true;
	}

	public boolean visitTupleExpr(TupleExpr node) {
		return true;
	}

	public boolean visitUnaryOp(UnaryOp node) {
		return true;
	}

	public boolean visitUnaryOperation(UnaryOperation node) {
		return true;
	}

	public boolean visitWhile(While node) {
		return true;
	}

	public boolean visitWith(With node) {
		return true;
	}

	public boolean visitWithItem(WithItem node) {
		return true;
	}

	public boolean visitYield(Yield node) {
		return true;
	}
}
