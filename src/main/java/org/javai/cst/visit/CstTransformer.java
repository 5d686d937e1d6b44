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
 * A traversal that rebuilds the tree bottom-up.
 * <p>
 * Each {@code leaveX} hook receives the original node and an updated node
 * whose children already went through the transformer, and returns what takes
 * the node's place: {@code updated} to keep it, another node, or one of the
 * {@link Replacement} operations. When no child changed, {@code updated} is
 * the original instance.
 */
public abstract class CstTransformer extends CstTraversal {

	public Replacement onLeave(CstNode original, CstNode updated) {
		return NodeDispatch.transform(this, original, updated);
	}

	public Replacement leaveAnnAssign(AnnAssign original, AnnAssign updated) {
		return updated;
	}

	public Replacement leaveAnnotation(Annotation original, Annotation updated) {
		return updated;
	}

	public Replacement leaveArg(Arg original, Arg updated) {
		return updated;
	}

	public Replacement leaveAsName(AsName original, AsName updated) {
		return updated;
	}

	public Replacement leaveAssert(Assert original, Assert updated) {
		return updated;
	}

	public Replacement leaveAssign(Assign original, Assign updated) {
		return updated;
	}

	public Replacement leaveAssignEqual(AssignEqual original, AssignEqual updated) {
		return updated;
	}

	public Replacement leaveAssignTarget(AssignTarget original, AssignTarget updated) {
		return updated;
	}

	public Replacement leaveAsynchronous(Asynchronous original, Asynchronous updated) {
		return updated;
	}

	public Replacement leaveAttribute(Attribute original, Attribute updated) {
		return updated;
	}

	public Replacement leaveAugAssign(AugAssign original, AugAssign updated) {
		return updated;
	}

	public Replacement leaveAugOp(AugOp original, AugOp updated) {
		return updated;
	}

	public Replacement leaveAwait(Await original, Await updated) {
		return updated;
	}

	public Replacement leaveBinaryOp(BinaryOp original, BinaryOp updated) {
		return updated;
	}

	public Replacement leaveBinaryOperation(BinaryOperation original, BinaryOperation updated) {
		return updated;
	}

	public Replacement leaveBooleanOp(BooleanOp original, BooleanOp updated) {
		return updated;
	}

	public Replacement leaveBooleanOperation(BooleanOperation original, BooleanOperation updated) {
		return updated;
	}

	public Replacement leaveBreak(Break original, Break updated) {
		return updated;
	}

	public Replacement leaveCall(Call original, Call updated) {
		return updated;
	}

	public Replacement leaveClassDef(ClassDef original, ClassDef updated) {
		return updated;
	}

	public Replacement leaveColon(Colon original, Colon updated) {
		return updated;
	}

	public Replacement leaveComma(Comma original, Comma updated) {
		return updated;
	}

	public Replacement leaveComment(Comment original, Comment updated) {
		return updated;
	}

	public Replacement leaveCompFor(CompFor original, CompFor updated) {
		return updated;
	}

	public Replacement leaveCompIf(CompIf original, CompIf updated) {
		return updated;
	}

	public Replacement leaveCompOp(CompOp original, CompOp updated) {
		return updated;
	}

	public Replacement leaveComparison(Comparison original, Comparison updated) {
		return updated;
	}

	public Replacement leaveComparisonTarget(ComparisonTarget original, ComparisonTarget updated) {
		return updated;
	}

	public Replacement leaveConcatenatedString(ConcatenatedString original, ConcatenatedString updated) {
		return updated;
	}

	public Replacement leaveContinue(Continue original, Continue updated) {
		return updated;
	}

	public Replacement leaveDecorator(Decorator original, Decorator updated) {
		return updated;
	}

	public Replacement leaveDel(Del original, Del updated) {
		return updated;
	}

	public Replacement leaveDictComp(DictComp original, DictComp updated) {
		return updated;
	}

	public Replacement leaveDictElement(DictElement original, DictElement updated) {
		return updated;
	}

	public Replacement leaveDictExpr(DictExpr original, DictExpr updated) {
		return updated;
	}

	public Replacement leaveDot(Dot original, Dot updated) {
		return updated;
	}

	public Replacement leaveElement(Element original, Element updated) {
		return updated;
	}

	public Replacement leaveElif(Elif original, Elif updated) {
		return updated;
	}

	public Replacement leaveEllipsis(Ellipsis original, Ellipsis updated) {
		return updated;
	}

	public Replacement leaveElse(Else original, Else updated) {
		return updated;
	}

	public Replacement leaveEmptyLine(EmptyLine original, EmptyLine updated) {
		return updated;
	}

	public Replacement leaveExceptHandler(ExceptHandler original, ExceptHandler updated) {
		return updated;
	}

	public Replacement leaveExpr(Expr original, Expr updated) {
		return updated;
	}

	public Replacement leaveFinally(Finally original, Finally updated) {
		return updated;
	}

	public Replacement leaveFloatLiteral(FloatLiteral original, FloatLiteral updated) {
		return updated;
	}

	public Replacement leaveFor(For original, For updated) {
		return updated;
	}

	public Replacement leaveFrom(From original, From updated) {
		return updated;
	}

	public Replacement leaveFunctionDef(FunctionDef original, FunctionDef updated) {
		return updated;
	}

	public Replacement leaveGeneratorExp(GeneratorExp original, GeneratorExp updated) {
		return updated;
	}

	public Replacement leaveGlobal(Global original, Global updated) {
		return updated;
	}

	public Replacement leaveIf(If original, If updated) {
		return updated;
	}

	public Replacement leaveIfExp(IfExp original, IfExp updated) {
		return updated;
	}

	public Replacement leaveImaginaryLiteral(ImaginaryLiteral original, ImaginaryLiteral updated) {
		return updated;
	}

	public Replacement leaveImport(Import original, Import updated) {
		return updated;
	}

	public Replacement leaveImportAlias(ImportAlias original, ImportAlias updated) {
		return updated;
	}

	public Replacement leaveImportFrom(ImportFrom original, ImportFrom updated) {
		return updated;
	}

	public Replacement leaveImportStar(ImportStar original, ImportStar updated) {
		return updated;
	}

	public Replacement leaveIndentedBlock(IndentedBlock original, IndentedBlock updated) {
		return updated;
	}

	public Replacement leaveIndex(Index original, Index updated) {
		return updated;
	}

	public Replacement leaveIntegerLiteral(IntegerLiteral original, IntegerLiteral updated) {
		return updated;
	}

	public Replacement leaveLambda(Lambda original, Lambda updated) {
		return updated;
	}

	public Replacement leaveLeftCurlyBrace(LeftCurlyBrace original, LeftCurlyBrace updated) {
		return updated;
	}

	public Replacement leaveLeftParen(LeftParen original, LeftParen updated) {
		return updated;
	}

	public Replacement leaveLeftSquareBracket(LeftSquareBracket original, LeftSquareBracket updated) {
		return updated;
	}

	public Replacement leaveListComp(ListComp original, ListComp updated) {
		return updated;
	}

	public Replacement leaveListExpr(ListExpr original, ListExpr updated) {
		return updated;
	}

	public Replacement leaveModule(Module original, Module updated) {
		return updated;
	}

	public Replacement leaveName(Name original, Name updated) {
		return updated;
	}

	public Replacement leaveNameItem(NameItem original, NameItem updated) {
		return updated;
	}

	public Replacement leaveNamedExpr(NamedExpr original, NamedExpr updated) {
		return updated;
	}

	public Replacement leaveNewline(Newline original, Newline updated) {
		return updated;
	}

	public Replacement leaveNonlocal(Nonlocal original, Nonlocal updated) {
		return updated;
	}

	public Replacement leaveParam(Param original, Param updated) {
		return updated;
	}

	public Replacement leaveParamSlash(ParamSlash original, ParamSlash updated) {
		return updated;
	}

	public Replacement leaveParamStar(ParamStar original, ParamStar updated) {
		return updated;
	}

	public Replacement leaveParameters(Parameters original, Parameters updated) {
		return updated;
	}

	public Replacement leaveParenthesizedWhitespace(ParenthesizedWhitespace original, ParenthesizedWhitespace updated) {
		return updated;
	}

	public Replacement leavePass(Pass original, Pass updated) {
		return updated;
	}

	public Replacement leaveRaise(Raise original, Raise updated) {
		return updated;
	}

	public Replacement leaveReturn(Return original, Return updated) {
		return updated;
	}

	public Replacement leaveRightCurlyBrace(RightCurlyBrace original, RightCurlyBrace updated) {
		return updated;
	}

	public Replacement leaveRightParen(RightParen original, RightParen updated) {
		return updated;
	}

	public Replacement leaveRightSquareBracket(RightSquareBracket original, RightSquareBracket updated) {
		return updated;
	}

	public Replacement leaveSemicolon(Semicolon original, Semicolon updated) {
		return updated;
	}

	public Replacement leaveSetComp(SetComp original, SetComp updated) {
		return updated;
	}

	public Replacement leaveSetExpr(SetExpr original, SetExpr updated) {
		return updated;
	}

	public Replacement leaveSimpleStatementLine(SimpleStatementLine original, SimpleStatementLine updated) {
		return updated;
	}

	public Replacement leaveSimpleStatementSuite(SimpleStatementSuite original, SimpleStatementSuite updated) {
		return updated;
	}

	public Replacement leaveSimpleString(SimpleString original, SimpleString updated) {
		return updated;
	}

	public Replacement leaveSimpleWhitespace(SimpleWhitespace original, SimpleWhitespace updated) {
		return updated;
	}

	public Replacement leaveSlice(Slice original, Slice updated) {
		return updated;
	}

	public Replacement leaveStarredDictElement(StarredDictElement original, StarredDictElement updated) {
		return updated;
	}

	public Replacement leaveStarredElement(StarredElement original, StarredElement updated) {
		return updated;
	}

	public Replacement leaveSubscript(Subscript original, Subscript updated) {
		return updated;
	}

	public Replacement leaveSubscriptElement(SubscriptElement original, SubscriptElement updated) {
		return updated;
	}

	public Replacement leaveTrailingWhitespace(TrailingWhitespace original, TrailingWhitespace updated) {
		return updated;
	}

	public Replacement leaveTry(Try original, Try updated) {
		return updated;
	}

	public Replacement leaveTupleExpr(TupleExpr original, TupleExpr updated) {
		return updated;
	}

	public Replacement leaveUnaryOp(UnaryOp original, UnaryOp updated) {
		return updated;
	}

	public Replacement leaveUnaryOperation(UnaryOperation original, UnaryOperation updated) {
		return updated;
	}

	public Replacement leaveWhile(While original, While updated) {
		return updated;
	}

	public Replacement leaveWith(With original, With updated) {
		return updated;
	}

	public Replacement leaveWithItem(WithItem original, WithItem updated) {
		return updated;
	}

	public Replacement leaveYield(Yield original, Yield updated) {
		return updated;
	}
}
