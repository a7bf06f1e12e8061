package hif.semantics;

import hif.model.Bit;
import hif.model.BitConstant;
import hif.model.BitValue;
import hif.model.Bitvector;
import hif.model.Bool;
import hif.model.BoolValue;
import hif.model.Cast;
import hif.model.ConstValue;
import hif.model.Declaration;
import hif.model.EnumType;
import hif.model.EnumValue;
import hif.model.Function;
import hif.model.Identifier;
import hif.model.Int;
import hif.model.IntValue;
import hif.model.LibraryDef;
import hif.model.Parameter;
import hif.model.Range;
import hif.model.Type;
import hif.model.TypeReference;
import hif.model.TypeTP;
import hif.model.Value;
import hif.util.Copier;

/**
 * Semantics of the native HIF dialect: strongly typed, no implicit conversion between scalar kinds
 * except bits and booleans.
 */
public class HifSemantics extends AbstractSemantics {
  public static final String NAME = "hif";
  public static final String STANDARD_LIBRARY = "hif_standard";

  public HifSemantics() {
    super(NAME);
    registerStandardLibrary(makeStandardLibrary(), true);
    addMapping(VerilogSemantics.NAME, VerilogSemantics.STANDARD_LIBRARY, "$clog2",
        new MappedSymbol(MapAction.MAP_KEEP, STANDARD_LIBRARY, "clog2"));
    addMapping(VerilogSemantics.NAME, VerilogSemantics.STANDARD_LIBRARY, "$signed", MappedSymbol.of(MapAction.SIMPLIFIED));
    addMapping(VerilogSemantics.NAME, VerilogSemantics.STANDARD_LIBRARY, "$unsigned", MappedSymbol.of(MapAction.SIMPLIFIED));
  }

  private static LibraryDef makeStandardLibrary() {
    LibraryDef lib = new LibraryDef(STANDARD_LIBRARY, true);

    // T max<T>(T a, T b)
    Function max = new Function("max", new TypeReference("T"));
    max.templateParameters.add(new TypeTP("T", null));
    max.parameters.add(new Parameter("a", new TypeReference("T"), null));
    max.parameters.add(new Parameter("b", new TypeReference("T"), null));
    lib.declarations.add(max);

    Function clog2 = new Function("clog2", new Int(new Range(31, 0), true));
    clog2.parameters.add(new Parameter("v", new Int(new Range(31, 0), true), null));
    lib.declarations.add(clog2);

    Function toInteger = new Function("to_integer", new Int(new Range(31, 0), true));
    toInteger.parameters.add(new Parameter("v", new Bitvector(null, false, true, true), null));
    lib.declarations.add(toInteger);
    return lib;
  }

  @Override
  protected boolean isImplicitlyConvertible(Type target, Type source) {
    return (target instanceof Bool && source instanceof Bit) || (target instanceof Bit && source instanceof Bool);
  }

  @Override
  protected Type makeConditionType() {
    return new Bool();
  }

  @Override
  protected boolean allowsNumericConditions() {
    return false;
  }

  @Override
  public Type getTypeForConstant(ConstValue constant) {
    Type ret;
    switch (constant.getKind()) {
    case INT_VALUE: {
      Int t = new Int(new Range(31, 0), true);
      t.setConstexpr(true);
      ret = t;
      break;
    }
    case BOOL_VALUE: {
      Bool t = new Bool();
      t.setConstexpr(true);
      ret = t;
      break;
    }
    case BIT_VALUE: {
      Bit t = new Bit(((BitValue)constant).getValue().logicOnly, false);
      t.setConstexpr(true);
      ret = t;
      break;
    }
    default:
      ret = null;
      break;
    }
    return ret;
  }

  @Override
  public Value getTypeDefaultValue(Type type, Declaration declaration) {
    Type base = SemanticTypes.getBaseType(type, false, this);
    if (base == null)
      return null;
    switch (base.getKind()) {
    case INT:
      return new IntValue(0);
    case BOOL:
      return new BoolValue(false);
    case BIT:
      return new BitValue(BitConstant.ZERO);
    case BITVECTOR:
      return new Cast(new IntValue(0), Copier.copy(type));
    case ENUM: {
      EnumType e = (EnumType)base;
      if (e.values.isEmpty())
        return null;
      EnumValue first = e.values.get(0);
      Identifier ret = new Identifier(first.getName());
      ret.setDeclaration(first);
      return ret;
    }
    default:
      return null;
    }
  }
}
