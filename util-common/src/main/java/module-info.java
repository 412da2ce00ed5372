module io.chainj.common {
	requires transitive org.jetbrains.annotations;

	exports io.chainj.common;
	exports io.chainj.common.exception;
	exports io.chainj.common.tuple;
}
