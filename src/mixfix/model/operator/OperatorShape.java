package mixfix.model.operator;

public enum OperatorShape {
	// one trailing placeholder, no leading one
	PREFIX,
	// one leading placeholder, no trailing one
	POSTFIX,
	// one leading and one trailing placeholder around a single keyword
	INFIX,
	// anything else, including closed operators like "( $x )" and "if $c then $a else $b"
	MIXFIX,
}
