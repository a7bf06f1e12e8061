package hif.compare;

import hif.model.Array;
import hif.model.Assign;
import hif.model.Bit;
import hif.model.BitValue;
import hif.model.Bitvector;
import hif.model.Bool;
import hif.model.BoolValue;
import hif.model.Call;
import hif.model.Cast;
import hif.model.Contents;
import hif.model.DataDeclaration;
import hif.model.DesignUnit;
import hif.model.Entity;
import hif.model.EnumType;
import hif.model.Expression;
import hif.model.Field;
import hif.model.FieldReference;
import hif.model.Function;
import hif.model.Instance;
import hif.model.Int;
import hif.model.IntValue;
import hif.model.Library;
import hif.model.LibraryDef;
import hif.model.Member;
import hif.model.NamedNode;
import hif.model.Node;
import hif.model.Parameter;
import hif.model.Port;
import hif.model.Range;
import hif.model.RangeDirection;
import hif.model.RecordType;
import hif.model.ReferencedAssign;
import hif.model.Return;
import hif.model.StateTable;
import hif.model.SubProgram;
import hif.model.Symbol;
import hif.model.SystemRoot;
import hif.model.TypeDef;
import hif.model.TypeReference;
import hif.model.TypeTP;
import hif.model.Value;
import hif.model.View;
import hif.model.ViewReference;
import hif.util.Copier;
import java.util.List;
import java.util.Objects;

/**
 * Deep structural comparison of subtrees.
 * Nodes of different variants are never equal; for the same variant, attributes are compared
 * according to the options, then children pairwise. Never resolves symbols, never mutates the tree.
 */
public class Equals {
  private final EqualsOptions options;
  private boolean inSignature = false;
  private boolean viewInterfaceCheck = false;

  private Equals(EqualsOptions options) {
    this.options = options;
  }

  public static boolean equals(Node obj1, Node obj2) {
    return equals(obj1, obj2, new EqualsOptions());
  }

  public static boolean equals(Node obj1, Node obj2, EqualsOptions options) {
    return new Equals(options).compare(obj1, obj2);
  }

  /** Compares two ordered lists pairwise; lists of different length are never equal. */
  public static boolean equalsList(List<? extends Node> list1, List<? extends Node> list2, EqualsOptions options) {
    return new Equals(options).compareLists(list1, list2);
  }

  private boolean compareLists(List<? extends Node> list1, List<? extends Node> list2) {
    if (list1 == list2)
      return true;
    if (list1.size() != list2.size())
      return false;
    for (int i = 0; i < list1.size(); ++i)
      if (!compare(list1.get(i), list2.get(i)))
        return false;
    return true;
  }

  private boolean compare(Node obj1, Node obj2) {
    if (obj1 == obj2)
      return true;
    if (obj1 == null)
      return options.skipNullBranches;
    if (obj2 == null)
      return false;

    if (options.checkOnlyNames)
      return equalNames(obj1, obj2);
    if (options.checkOnlySymbolsDeclarations && sameCachedDeclaration(obj1, obj2))
      return true;

    if (options.handleVectorTypes) {
      obj1 = asVector(obj1);
      obj2 = asVector(obj2);
    }

    if (obj1.getKind() != obj2.getKind())
      return false;
    if (options.checkOnlyTypes)
      return true;
    if (options.checkCodeInfo && !Objects.equals(obj1.getCodeInfo(), obj2.getCodeInfo()))
      return false;
    return compareSameKind(obj1, obj2);
  }

  private boolean compareSameKind(Node obj1, Node obj2) {
    switch (obj1.getKind()) {
    case SYSTEM: {
      SystemRoot o1 = (SystemRoot)obj1, o2 = (SystemRoot)obj2;
      return sameName(o1, o2)
          && children(o1.designUnits, o2.designUnits)
          && children(o1.libraryDefs, o2.libraryDefs)
          && children(o1.declarations, o2.declarations)
          && children(o1.libraries, o2.libraries);
    }
    case LIBRARY_DEF: {
      LibraryDef o1 = (LibraryDef)obj1, o2 = (LibraryDef)obj2;
      return sameName(o1, o2)
          && o1.isStandard() == o2.isStandard()
          && children(o1.declarations, o2.declarations)
          && children(o1.libraries, o2.libraries);
    }
    case DESIGN_UNIT: {
      DesignUnit o1 = (DesignUnit)obj1, o2 = (DesignUnit)obj2;
      return sameName(o1, o2) && children(o1.views, o2.views);
    }
    case VIEW:
      return compareViews((View)obj1, (View)obj2);
    case ENTITY: {
      Entity o1 = (Entity)obj1, o2 = (Entity)obj2;
      return sameName(o1, o2) && children(o1.ports, o2.ports);
    }
    case CONTENTS: {
      Contents o1 = (Contents)obj1, o2 = (Contents)obj2;
      return sameName(o1, o2)
          && children(o1.declarations, o2.declarations)
          && children(o1.libraries, o2.libraries)
          && children(o1.stateTables, o2.stateTables)
          && children(o1.instances, o2.instances);
    }
    case STATE_TABLE: {
      StateTable o1 = (StateTable)obj1, o2 = (StateTable)obj2;
      return sameName(o1, o2)
          && children(o1.declarations, o2.declarations)
          && children(o1.actions, o2.actions);
    }
    case FUNCTION:
    case PROCEDURE:
      return compareSubPrograms((SubProgram)obj1, (SubProgram)obj2);
    case PARAMETER: {
      Parameter o1 = (Parameter)obj1, o2 = (Parameter)obj2;
      if (!options.skipDeclarationBodies && !sameName(o1, o2))
        return false;
      return o1.getDirection() == o2.getDirection() && compareDataDeclarationContents(o1, o2, true);
    }
    case PORT: {
      Port o1 = (Port)obj1, o2 = (Port)obj2;
      return sameName(o1, o2) && o1.getDirection() == o2.getDirection() && compareDataDeclarationContents(o1, o2, true);
    }
    case VALUE_TP: {
      DataDeclaration o1 = (DataDeclaration)obj1, o2 = (DataDeclaration)obj2;
      if (!options.skipDeclarationBodies && !sameName(o1, o2))
        return false;
      return compareDataDeclarationContents(o1, o2, true);
    }
    case VARIABLE:
    case CONST:
    case SIGNAL:
    case ENUM_VALUE: {
      DataDeclaration o1 = (DataDeclaration)obj1, o2 = (DataDeclaration)obj2;
      return sameName(o1, o2) && compareDataDeclarationContents(o1, o2, true);
    }
    case FIELD: {
      Field o1 = (Field)obj1, o2 = (Field)obj2;
      return sameName(o1, o2) && compareDataDeclarationContents(o1, o2, options.checkFieldsInitialValue);
    }
    case TYPE_DEF:
      return compareTypeDefs((TypeDef)obj1, (TypeDef)obj2);
    case TYPE_TP: {
      TypeTP o1 = (TypeTP)obj1, o2 = (TypeTP)obj2;
      if (!options.skipDeclarationBodies && !sameName(o1, o2))
        return false;
      return children(o1.getType(), o2.getType());
    }
    case INSTANCE: {
      Instance o1 = (Instance)obj1, o2 = (Instance)obj2;
      return sameName(o1, o2)
          && symbolDeclarations(o1, o2)
          && children(o1.getReferencedType(), o2.getReferencedType())
          && children(o1.portAssigns, o2.portAssigns);
    }
    case LIBRARY: {
      Library o1 = (Library)obj1, o2 = (Library)obj2;
      return sameName(o1, o2) && o1.isSystem() == o2.isSystem() && symbolDeclarations(o1, o2);
    }
    case PARAMETER_ASSIGN:
    case PORT_ASSIGN:
    case VALUE_TP_ASSIGN:
    case TYPE_TP_ASSIGN: {
      ReferencedAssign o1 = (ReferencedAssign)obj1, o2 = (ReferencedAssign)obj2;
      return sameName(o1, o2) && children(o1.getPayload(), o2.getPayload()) && symbolDeclarations(o1, o2);
    }
    case BIT: {
      Bit o1 = (Bit)obj1, o2 = (Bit)obj2;
      if (options.handleConstexprTypes && (o1.isConstexpr() || o2.isConstexpr()))
        return true;
      return (!options.checkResolvedFlag || o1.isResolved() == o2.isResolved())
          && (!options.checkConstexprFlag || o1.isConstexpr() == o2.isConstexpr())
          && (!options.checkLogicFlag || o1.isLogic() == o2.isLogic());
    }
    case BOOL: {
      Bool o1 = (Bool)obj1, o2 = (Bool)obj2;
      if (options.handleConstexprTypes && (o1.isConstexpr() || o2.isConstexpr()))
        return true;
      return !options.checkConstexprFlag || o1.isConstexpr() == o2.isConstexpr();
    }
    case INT: {
      Int o1 = (Int)obj1, o2 = (Int)obj2;
      if (options.handleConstexprTypes && (o1.isConstexpr() || o2.isConstexpr()))
        return true;
      return spans(o1.getSpan(), o2.getSpan())
          && (!options.checkConstexprFlag || o1.isConstexpr() == o2.isConstexpr())
          && (!options.checkSignedFlag || o1.isSigned() == o2.isSigned());
    }
    case BITVECTOR: {
      Bitvector o1 = (Bitvector)obj1, o2 = (Bitvector)obj2;
      if (options.handleConstexprTypes && (o1.isConstexpr() || o2.isConstexpr())) {
        if (!spansOfConstexpr(o1.getSpan(), o2.getSpan()))
          return false;
      } else {
        if (!spans(o1.getSpan(), o2.getSpan()))
          return false;
        if (options.checkConstexprFlag && o1.isConstexpr() != o2.isConstexpr())
          return false;
        if (options.checkSignedFlag && o1.isSigned() != o2.isSigned())
          return false;
      }
      return (!options.checkLogicFlag || o1.isLogic() == o2.isLogic())
          && (!options.checkResolvedFlag || o1.isResolved() == o2.isResolved());
    }
    case ARRAY: {
      Array o1 = (Array)obj1, o2 = (Array)obj2;
      return spans(o1.getSpan(), o2.getSpan())
          && (!options.checkSignedFlag || o1.isSigned() == o2.isSigned())
          && innerType(o1.getType(), o2.getType());
    }
    case RECORD:
      return children(((RecordType)obj1).fields, ((RecordType)obj2).fields);
    case ENUM:
      return children(((EnumType)obj1).values, ((EnumType)obj2).values);
    case TYPE_REFERENCE: {
      TypeReference o1 = (TypeReference)obj1, o2 = (TypeReference)obj2;
      return sameName(o1, o2)
          && children(o1.templateParameterAssigns, o2.templateParameterAssigns)
          && symbolDeclarations(o1, o2);
    }
    case VIEW_REFERENCE: {
      ViewReference o1 = (ViewReference)obj1, o2 = (ViewReference)obj2;
      return sameName(o1, o2)
          && o1.getDesignUnit().equals(o2.getDesignUnit())
          && children(o1.templateParameterAssigns, o2.templateParameterAssigns)
          && symbolDeclarations(o1, o2);
    }
    case RANGE: {
      Range o1 = (Range)obj1, o2 = (Range)obj2;
      if (options.checkSpanDirection && o1.getDirection() != o2.getDirection())
        return false;
      return children(minBound(o1), minBound(o2)) && children(maxBound(o1), maxBound(o2));
    }
    case IDENTIFIER: {
      NamedNode o1 = (NamedNode)obj1, o2 = (NamedNode)obj2;
      if ((!options.skipDeclarationBodies || !inSignature) && !o1.getName().equals(o2.getName()))
        return false;
      return symbolDeclarations((Symbol)obj1, (Symbol)obj2);
    }
    case INT_VALUE: {
      IntValue o1 = (IntValue)obj1, o2 = (IntValue)obj2;
      return o1.getValue() == o2.getValue() && children(o1.getType(), o2.getType());
    }
    case BOOL_VALUE: {
      BoolValue o1 = (BoolValue)obj1, o2 = (BoolValue)obj2;
      return o1.getValue() == o2.getValue() && children(o1.getType(), o2.getType());
    }
    case BIT_VALUE: {
      BitValue o1 = (BitValue)obj1, o2 = (BitValue)obj2;
      return o1.getValue() == o2.getValue() && children(o1.getType(), o2.getType());
    }
    case EXPRESSION: {
      Expression o1 = (Expression)obj1, o2 = (Expression)obj2;
      return o1.getOperator() == o2.getOperator()
          && children(o1.getValue1(), o2.getValue1())
          && children(o1.getValue2(), o2.getValue2());
    }
    case CAST: {
      Cast o1 = (Cast)obj1, o2 = (Cast)obj2;
      return children(o1.getValue(), o2.getValue()) && children(o1.getType(), o2.getType());
    }
    case FUNCTION_CALL:
    case PROCEDURE_CALL: {
      Call o1 = (Call)obj1, o2 = (Call)obj2;
      return sameName(o1, o2)
          && children(o1.getTemplateParameterAssigns(), o2.getTemplateParameterAssigns())
          && children(o1.getParameterAssigns(), o2.getParameterAssigns())
          && (!options.checkReferencedInstance || children(o1.getInstance(), o2.getInstance()))
          && symbolDeclarations(o1, o2);
    }
    case FIELD_REFERENCE: {
      FieldReference o1 = (FieldReference)obj1, o2 = (FieldReference)obj2;
      return sameName(o1, o2) && children(o1.getPrefix(), o2.getPrefix()) && symbolDeclarations(o1, o2);
    }
    case MEMBER: {
      Member o1 = (Member)obj1, o2 = (Member)obj2;
      return children(o1.getPrefix(), o2.getPrefix()) && children(o1.getIndex(), o2.getIndex());
    }
    case ASSIGN: {
      Assign o1 = (Assign)obj1, o2 = (Assign)obj2;
      return children(o1.getLeftHandSide(), o2.getLeftHandSide())
          && children(o1.getRightHandSide(), o2.getRightHandSide());
    }
    case RETURN:
      return children(((Return)obj1).getValue(), ((Return)obj2).getValue());
    default:
      throw new IllegalStateException("Unhandled node kind " + obj1.getKind());
    }
  }

  private boolean compareViews(View o1, View o2) {
    if (!sameName(o1, o2))
      return false;
    boolean restoreSignature = inSignature;
    boolean restoreInterface = viewInterfaceCheck;
    inSignature = options.skipDeclarationBodies;
    viewInterfaceCheck = options.skipViewContents;
    try {
      if (!options.skipViewContents && !children(o1.templateParameters, o2.templateParameters))
        return false;
      if (!children(o1.getEntity(), o2.getEntity()))
        return false;
      if (!options.skipDeclarationBodies && !options.skipViewContents) {
        return children(o1.declarations, o2.declarations)
            && children(o1.libraries, o2.libraries)
            && children(o1.getContents(), o2.getContents());
      }
      return true;
    } finally {
      inSignature = restoreSignature;
      viewInterfaceCheck = restoreInterface;
    }
  }

  private boolean compareSubPrograms(SubProgram o1, SubProgram o2) {
    if (!sameName(o1, o2) || o1.getSubProgramKind() != o2.getSubProgramKind())
      return false;
    boolean restore = inSignature;
    inSignature = options.skipDeclarationBodies;
    try {
      if (!children(o1.templateParameters, o2.templateParameters))
        return false;
      if (o1 instanceof Function && !children(((Function)o1).getType(), ((Function)o2).getType()))
        return false;
      if (!children(o1.parameters, o2.parameters))
        return false;
      return options.skipDeclarationBodies || children(o1.getStateTable(), o2.getStateTable());
    } finally {
      inSignature = restore;
    }
  }

  private boolean compareTypeDefs(TypeDef o1, TypeDef o2) {
    if (!sameName(o1, o2))
      return false;
    if (options.handleExternalsTypedefs && (o1.isExternal() || o2.isExternal()))
      return true;
    boolean restore = inSignature;
    inSignature = options.skipDeclarationBodies;
    try {
      if (!children(o1.templateParameters, o2.templateParameters))
        return false;
      if (o1.isOpaque() != o2.isOpaque() || o1.isExternal() != o2.isExternal())
        return false;
      return options.skipDeclarationBodies || children(o1.getType(), o2.getType());
    } finally {
      inSignature = restore;
    }
  }

  private boolean compareDataDeclarationContents(DataDeclaration o1, DataDeclaration o2, boolean checkValue) {
    if (!children(o1.getType(), o2.getType()))
      return false;
    if (checkValue && !children(o1.getValue(), o2.getValue()))
      return false;
    return !options.checkDeclarationRangeConstraint || children(o1.getRange(), o2.getRange());
  }

  //// Helpers ////

  private boolean children(Node o1, Node o2) {
    if (options.skipChildren && !inSignature)
      return true;
    return compare(o1, o2);
  }

  private boolean children(List<? extends Node> l1, List<? extends Node> l2) {
    if (options.skipChildren && !inSignature)
      return true;
    return compareLists(l1, l2);
  }

  private boolean innerType(Node t1, Node t2) {
    if (!options.checkInnerTypeOfComposite && !inSignature)
      return true;
    return children(t1, t2);
  }

  private boolean spans(Range r1, Range r2) {
    if (!options.checkSpans || viewInterfaceCheck)
      return true;
    return children(r1, r2);
  }

  /** Spans of constexpr types: equal bounds, or else equal constant sizes regardless of direction. */
  private boolean spansOfConstexpr(Range r1, Range r2) {
    if (!options.checkSpans || viewInterfaceCheck)
      return true;
    if (children(r1, r2))
      return true;
    long s1 = spanSize(r1);
    long s2 = spanSize(r2);
    return s1 > 0 && s1 == s2;
  }

  /** Size of a constant span, or 0 if not constant. */
  public static long spanSize(Range r) {
    if (r == null || !(r.getLeftBound() instanceof IntValue) || !(r.getRightBound() instanceof IntValue))
      return 0;
    long l = ((IntValue)r.getLeftBound()).getValue();
    long h = ((IntValue)r.getRightBound()).getValue();
    return Math.abs(l - h) + 1;
  }

  private static Value minBound(Range r) {
    return r.getDirection() == RangeDirection.DOWNTO ? r.getRightBound() : r.getLeftBound();
  }
  private static Value maxBound(Range r) {
    return r.getDirection() == RangeDirection.DOWNTO ? r.getLeftBound() : r.getRightBound();
  }

  private static boolean sameName(NamedNode o1, NamedNode o2) {
    return o1.getName().equals(o2.getName());
  }

  private static boolean equalNames(Node obj1, Node obj2) {
    String n1 = (obj1 instanceof NamedNode) ? ((NamedNode)obj1).getName() : "";
    String n2 = (obj2 instanceof NamedNode) ? ((NamedNode)obj2).getName() : "";
    return n1.equals(n2);
  }

  private static boolean sameCachedDeclaration(Node obj1, Node obj2) {
    if (!(obj1 instanceof Symbol) || !(obj2 instanceof Symbol))
      return false;
    var d1 = ((Symbol)obj1).getDeclaration();
    var d2 = ((Symbol)obj2).getDeclaration();
    return d1 != null && d1 == d2;
  }

  private boolean symbolDeclarations(Symbol s1, Symbol s2) {
    if (!options.assureSameSymbolDeclarations)
      return true;
    var d1 = s1.getDeclaration();
    var d2 = s2.getDeclaration();
    return d1 == d2 || d1 == null || d2 == null;
  }

  /** Arrays of bits are seen as bit vectors with the array's span and signedness. */
  private static Node asVector(Node obj) {
    if (!(obj instanceof Array) || !(((Array)obj).getType() instanceof Bit))
      return obj;
    Array array = (Array)obj;
    Bit bit = (Bit)array.getType();
    Bitvector ret = new Bitvector(Copier.copy(array.getSpan()), array.isSigned(), bit.isLogic(), bit.isResolved());
    ret.setConstexpr(bit.isConstexpr());
    return ret;
  }
}
