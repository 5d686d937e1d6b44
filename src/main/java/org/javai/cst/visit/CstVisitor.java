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
 * A read-only traversal. Override the {@code visitX} and {@code leaveX}
 * hooks for the node types of interest, or {@link #onVisit(CstNode)} and
 * {@link #onLeave(CstNode)} to see every node.
 */
public abstract class CstVisitor extends CstTraversal {

	/**
	 * Called after the children of {@code node} were visited, or were skipped.
	 */
	public void onLeave(CstNode node) {
		NodeDispatch.leave(this, node);
	}

	public void leaveAnnAssign(AnnAssign node) {
	}

	public void leaveAnnotation(Annotation node) {
	}

	public void leaveArg(Arg node) {
	}

	public void leaveAsName(AsName node) {
	}

	public void leaveAssert(Assert node) {
	}

	public void leaveAssign(Assign node) {
	}

	public void leaveAssignEqual(AssignEqual node) {
	}

	public void leaveAssignTarget(AssignTarget node) {
	}

	public void leaveAsynchronous(Asynchronous node) {
	}

	public void leaveAttribute(Attribute node) {
	}

	public void leaveAugAssign(AugAssign node) {
	}

	public void leaveAugOp(AugOp node) {
	}

	public void leaveAwait(Await node) {
	}

	public void leaveBinaryOp(BinaryOp node) {
	}

	public void leaveBinaryOperation(BinaryOperation node) {
	}

	public void leaveBooleanOp(BooleanOp node) {
	}

	public void leaveBooleanOperation(BooleanOperation node) {
	}

	public void leaveBreak(Break node) {
	}

	public void leaveCall(Call node) {
	}

	public void leaveClassDef(ClassDef node) {
	}

	public void leaveColon(Colon node) {
	}

	public void leaveComma(Comma node) {
	}

	public void leaveComment(Comment node) {
	}

	public void leaveCompFor(CompFor node) {
	}

	public void leaveCompIf(CompIf node) {
	}

	public void leaveCompOp(CompOp node) {
	}

	public void leaveComparison(Comparison node) {
	}

	public void leaveComparisonTarget(ComparisonTarget node) {
	}

	public void leaveConcatenatedString(ConcatenatedString node) {
	}

	public void leaveContinue(Continue node) {
	}

	public void leaveDecorator(Decorator node) {
	}

	public void leaveDel(Del node) {
	}

	public void leaveDictComp(DictComp node) {
	}

	public void leaveDictElement(DictElement node) {
	}

	public void leaveDictExpr(DictExpr node) {
	}

	public void leaveDot(Dot node) {
	}

	public void leaveElement(Element node) {
	}

	public void leaveElif(Elif node) {
	}

	public void leaveEllipsis(Ellipsis node) {
	}

	public void leaveElse(Else node) {
	}

	public void leaveEmptyLine(EmptyLine node) {
	}

	public void leaveExceptHandler(ExceptHandler node) {
	}

	public void leaveExpr(Expr node) {
	}

	public void leaveFinally(Finally node) {
	}

	public void leaveFloatLiteral(FloatLiteral node) {
	}

	public void leaveFor(For node) {
	}

	public void leaveFrom(From node) {
	}

	public void leaveFunctionDef(FunctionDef node) {
	}

	public void leaveGeneratorExp(GeneratorExp node) {
	}

	public void leaveGlobal(Global node) {
	}

	public void leaveIf(If node) {
	}

	public void leaveIfExp(IfExp node) {
	}

	public void leaveImaginaryLiteral(ImaginaryLiteral node) {
	}

	public void leaveImport(Import node) {
	}

	public void leaveImportAlias(ImportAlias node) {
	}

	public void leaveImportFrom(ImportFrom node) {
	}

	public void leaveImportStar(ImportStar node) {
	}

	public void leaveIndentedBlock(IndentedBlock node) {
	}

	public void leaveIndex(Index node) {
	}

	public void leaveIntegerLiteral(IntegerLiteral node) {
	}

	public void leaveLambda(Lambda node) {
	}

	public void leaveLeftCurlyBrace(LeftCurlyBrace node) {
	}

	public void leaveLeftParen(LeftParen node) {
	}

	public void leaveLeftSquareBracket(LeftSquareBracket node) {
	}

	public void leaveListComp(ListComp node) {
	}

	public void leaveListExpr(ListExpr node) {
	}

	public void leaveModule(Module node) {
	}

	public void leaveName(Name node) {
	}

	public void leaveNameItem(NameItem node) {
	}

	public void leaveNamedExpr(NamedExpr node) {
	}

	public void leaveNewline(Newline node) {
	}

	public void leaveNonlocal(Nonlocal node) {
	}

	public void leaveParam(Param node) {
	}

	public void leaveParamSlash(ParamSlash node) {
	}

	public void leaveParamStar(ParamStar node) {
	}

	public void leaveParameters(Parameters node) {
	}

	public void leaveParenthesizedWhitespace(ParenthesizedWhitespace node) {
	}

	public void leavePass(Pass node) {
	}

	public void leaveRaise(Raise node) {
	}

	public void leaveReturn(Return node) {
	}

	public void leaveRightCurlyBrace(RightCurlyBrace node) {
	}

	public void leaveRightParen(RightParen node) {
	}

	public void leaveRightSquareBracket(RightSquareBracket node) {
	}

	public void leaveSemicolon(Semicolon node) {
	}

	public void leaveSetComp(SetComp node) {
	}

	public void leaveSetExpr(SetExpr node) {
	}

	public void leaveSimpleStatementLine(SimpleStatementLine node) {
	}

	public void leaveSimpleStatementSuite(SimpleStatementSuite node) {
	}

	public void leaveSimpleString(SimpleString node) {
	}

	public void leaveSimpleWhitespace(SimpleWhitespace node) {
	}

	public void leaveSlice(Slice node) {
	}

	public void leaveStarredDictElement(StarredDictElement node) {
	}

	public void leaveStarredElement(StarredElement node) {
	}

	public void leaveSubscript(Subscript node) {
	}

	public void leaveSubscriptElement(SubscriptElement node) {
	}

	public void leaveTrailingWhitespace(TrailingWhitespace node) {
	}

	public void leaveTry(Try node) {
	}

	public void leaveTupleExpr(TupleExpr node) {
	}

	public void leaveUnaryOp(UnaryOp node) {
	}

	public void leaveUnaryOperation(UnaryOperation node) {
	}

	public void leaveWhile(While node) {
	}

	public void leaveWith(With node) {
	}

	public void leaveWithItem(WithItem node) {
	}

	public void leaveYield(Yield node) {
	}
}
