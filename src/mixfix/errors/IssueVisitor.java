package mixfix.errors;

import mixfix.config.IOErrorIssue;
import mixfix.config.OptionParserIssue;
import mixfix.lexer.TokenReaderIssue;
import mixfix.model.category.CategoryCycleIssue;
import mixfix.model.category.UnknownCategoryIssue;
import mixfix.parser.AmbiguousExpressionIssue;
import mixfix.parser.NoParseIssue;
import mixfix.parser.ParameterArityIssue;
import mixfix.parser.UnknownParameterIssue;
import mixfix.registry.DuplicateOperatorIssue;
import mixfix.registry.MalformedOperatorIssue;
import mixfix.registry.UndeclaredOperatorSymbolIssue;
import mixfix.registry.UnknownCombinatorIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(CategoryCycleIssue categoryCycleIssue) throws E;
	public abstract T visit(UnknownCategoryIssue unknownCategoryIssue) throws E;
	public abstract T visit(DuplicateOperatorIssue duplicateOperatorIssue) throws E;
	public abstract T visit(MalformedOperatorIssue malformedOperatorIssue) throws E;
	public abstract T visit(UndeclaredOperatorSymbolIssue undeclaredOperatorSymbolIssue) throws E;
	public abstract T visit(UnknownCombinatorIssue unknownCombinatorIssue) throws E;
	public abstract T visit(NoParseIssue noParseIssue) throws E;
	public abstract T visit(AmbiguousExpressionIssue ambiguousExpressionIssue) throws E;
	public abstract T visit(UnknownParameterIssue unknownParameterIssue) throws E;
	public abstract T visit(ParameterArityIssue parameterArityIssue) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(TokenReaderIssue tokenReaderIssue) throws E;
}
