package hif.semantics;

import hif.manipulation.SortMissingKind;
import hif.model.Array;
import hif.model.Bit;
import hif.model.BitConstant;
import hif.model.BitValue;
import hif.model.Bitvector;
import hif.model.Bool;
import hif.model.Cast;
import hif.model.ConstValue;
import hif.model.Declaration;
import hif.model.Function;
import hif.model.Int;
import hif.model.IntValue;
import hif.model.LibraryDef;
import hif.model.Parameter;
import hif.model.Range;
import hif.model.Type;
import hif.model.Value;
import hif.util.Copier;

/**
 * Verilog semantics: every scalar converts implicitly into every other, bits are four-valued,
 * and there are neither booleans nor user-defined records and enumerations.
 */
public class VerilogSemantics extends AbstractSemantics {
  public static final String NAME = "verilog";
  public static final String STANDARD_LIBRARY = "verilog_standard";

  public VerilogSemantics() {
    super(NAME);
    registerStandardLibrary(makeStandardLibrary(), true);
    addMapping(HifSemantics.NAME, HifSemantics.STANDARD_LIBRARY, "clog2",
        new MappedSymbol(MapAction.MAP_DELETE, STANDARD_LIBRARY, "$clog2"));
    addMapping(HifSemantics.NAME, HifSemantics.STANDARD_LIBRARY, "to_integer",
        new MappedSymbol(MapAction.MAP_KEEP, STANDARD_LIBRARY, "$unsigned"));
  }

  private static LibraryDef makeStandardLibrary() {
    LibraryDef lib = new LibraryDef(STANDARD_LIBRARY, true);

    Function clog2 = new Function("$clog2", new Int(new Range(31, 0), true));
    clog2.parameters.add(new Parameter("v", new Int(new Range(31, 0), true), null));
    lib.declarations.add(clog2);

    Function signed = new Function("$signed", new Bitvector(null, true, true, true));
    signed.parameters.add(new Parameter("v", new Bitvector(null, false, true, true), null));
    lib.declarations.add(signed);

    Function unsigned = new Function("$unsigned", new Bitvector(null, false, true, true));
    unsigned.parameters.add(new Parameter("v", new Bitvector(null, false, true, true), null));
    lib.declarations.add(unsigned);
    return lib;
  }

  /** Verilog port maps are usually partial: only complete while named ports remain. */
  @Override
  public SortMissingKind getSortMissingKind() {
    return SortMissingKind.LIMITED;
  }

  @Override
  protected boolean isImplicitlyConvertible(Type target, Type source) {
    return !(target instanceof Bool) && !(source instanceof Bool);
  }

  @Override
  protected Type makeConditionType() {
    return new Bit(true, true);
  }

  @Override
  protected boolean allowsNumericConditions() {
    return true;
  }

  @Override
  public boolean isTypeAllowed(Type type) {
    if (type == null || type instanceof Bool || isUserComposite(type))
      return false;
    if (type instanceof Array)
      return isTypeAllowed(((Array)type).getType());
    return true;
  }

  @Override
  public Type getTypeForConstant(ConstValue constant) {
    switch (constant.getKind()) {
    case INT_VALUE: {
      Int ret = new Int(new Range(31, 0), true);
      ret.setConstexpr(true);
      return ret;
    }
    case BOOL_VALUE:
    case BIT_VALUE: {
      Bit ret = new Bit(true, true);
      ret.setConstexpr(true);
      return ret;
    }
    default:
      return null;
    }
  }

  @Override
  public Value getTypeDefaultValue(Type type, Declaration declaration) {
    Type base = SemanticTypes.getBaseType(type, false, this);
    if (base == null)
      return null;
    switch (base.getKind()) {
    case INT:
      return new IntValue(0);
    case BIT:
      return new BitValue(((Bit)base).isLogic() ? BitConstant.X : BitConstant.ZERO);
    case BITVECTOR:
      return new Cast(new IntValue(0), Copier.copy(type));
    default:
      return null;
    }
  }
}
