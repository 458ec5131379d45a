package eventcoder.parse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.stanford.nlp.trees.Tree;
import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.util.TreeOperator;


/**
 * Converts a bracketed constituency parse into a flat TokenSequence.
 *
 * Noun phrases without nested noun phrases become entity spans
 * (NE --- words ~NE).  Possessives are recombined into a single entity,
 * simple prepositional noun phrases of the form (NP (NP ...) (PP (IN ...) (NP ...)))
 * are flattened into one entity, and subordinate clauses inside noun phrases
 * are collapsed to a flat SBR word list.  Coordinated noun phrases with at
 * least three noun labels become compounds (NEC) whose heads are expanded
 * into one entity each.  NP, VP and top-level NEC markers are numbered in
 * document order.
 */
public class TreeNormalizer {
  private static final Redwood.RedwoodChannels log = Redwood.channels(TreeNormalizer.class);

  public TreeNormalizer() { }

  /**
   * @param parse A Penn Treebank style parse of one sentence.
   */
  public Outcome<TokenSequence> normalize(String parse) {
    if( parse == null || count(parse, '(') != count(parse, ')') )
      return Outcome.failed(SkipReason.BAD_INPUT_PARSE);

    Tree tree;
    try {
      tree = TreeOperator.stringToTree(parse);
    } catch( IOException ex ) {
      log.warn("Unreadable parse: " + ex.getMessage());
      return Outcome.failed(SkipReason.BAD_INPUT_PARSE);
    } catch( RuntimeException ex ) {
      log.warn("Unreadable parse: " + ex);
      return Outcome.failed(SkipReason.BAD_INPUT_PARSE);
    }
    if( tree == null )
      return Outcome.failed(SkipReason.BAD_INPUT_PARSE);

    TreeOperator.upperCaseLeaves(tree);
    if( tree.value() == null || tree.value().length() == 0 )
      tree.setValue("ROOT");
    else if( !tree.value().equals("ROOT") )
      tree = TreeOperator.factory().newTreeNode("ROOT", Collections.singletonList(tree));

    markCompounds(tree);

    Emitter emitter = new Emitter(tree);
    if( !emitter.emit(tree) )
      return Outcome.failed(SkipReason.EMPTY_NPLIST);

    TokenSequence seq = emitter.sequence();
    if( !seq.resolveCloses() )
      return Outcome.failed(SkipReason.BAD_FINAL_PARSE);
    if( isDateline(seq) )
      return Outcome.failed(SkipReason.DATELINE);
    if( !seq.isBalanced() )
      return Outcome.failed(SkipReason.BAD_FINAL_PARSE);
    return Outcome.of(seq);
  }

  private static int count(String str, char ch) {
    int n = 0;
    for( int i = 0; i < str.length(); i++ )
      if( str.charAt(i) == ch ) n++;
    return n;
  }

  /**
   * Relabel coordinations.  A CC inside a verb or clause phrase, or next to
   * another CC, becomes CCP.  Otherwise a CC whose parent is an NP holding at
   * least three noun labels turns that NP into a compound, NEC.
   */
  void markCompounds(Tree root) {
    List<Tree> nodes = root.preOrderNodeList();
    for( Tree node : nodes ) {
      if( node.isLeaf() || !"CC".equals(node.value()) )
        continue;
      Tree parent = node.parent(root);
      if( parent == null ) continue;

      if( TreeOperator.countLabels(parent, "VP") > 0 || TreeOperator.countLabels(parent, "S") > 0 )
        node.setValue("CCP");
      else if( TreeOperator.countLabels(parent, "CC") > 1 )
        node.setValue("CCP");
      else if( parent.value() != null && parent.value().startsWith("NP")
               && TreeOperator.countLabels(parent, "N") >= 3 )
        parent.setValue(Token.COMPOUND);
    }
  }

  /** ROOT NE NEC as the first three markers: a dateline header, not a sentence. */
  private boolean isDateline(TokenSequence seq) {
    List<String> labels = new ArrayList<String>();
    for( Token tok : seq ) {
      if( tok.isOpen() ) {
        labels.add(tok.label());
        if( labels.size() == 3 ) break;
      }
    }
    return labels.size() == 3 && labels.get(0).equals("ROOT")
        && labels.get(1).equals(Token.ENTITY) && labels.get(2).equals(Token.COMPOUND);
  }


  /**
   * Walks one tree and writes its tokens.  Holds the per-sentence counters.
   */
  private static class Emitter {
    private final Tree _root;
    private final TokenSequence _seq = new TokenSequence();
    private int _npIndex = 1;
    private int _vpIndex = 1;
    private int _necIndex = 1;

    Emitter(Tree root) {
      _root = root;
    }

    TokenSequence sequence() { return _seq; }

    /**
     * @return False if an entity came out with no words.
     */
    boolean emit(Tree node) {
      if( node.isLeaf() ) {
        _seq.add(Token.word(node.value()));
        return true;
      }
      String label = node.value();

      if( "NP".equals(label) ) {
        List<Token> content = nounPhrase(node);
        if( content != null )
          return addEntity(content);
        _seq.add(Token.open("NP", _npIndex++));
      }
      else if( Token.COMPOUND.equals(label) ) {
        _seq.add(Token.open(Token.COMPOUND, _necIndex++));
        boolean ok = compound(node);
        _seq.add(Token.pendingClose());
        return ok;
      }
      else if( "VP".equals(label) )
        _seq.add(Token.open("VP", _vpIndex++));
      else
        _seq.add(Token.open(label));

      for( Tree child : node.children() ) {
        if( !emit(child) ) return false;
      }
      _seq.add(Token.pendingClose());
      return true;
    }

    /**
     * @return The entity content of a noun phrase, or null if the phrase keeps
     *         its structure.
     */
    private List<Token> nounPhrase(Tree np) {
      reduceSubordinates(np);

      if( TreeOperator.hasDescendant(np, "POS") ) {
        List<Token> content = new ArrayList<Token>();
        entityWords(np, content, true);
        return content;
      }
      else if( TreeOperator.hasDescendant(np, "PP") )
        return preposition(TreeOperator.firstDescendant(np, "PP"));
      else if( !TreeOperator.hasDescendant(np, "NP") && !TreeOperator.hasDescendant(np, Token.COMPOUND) ) {
        List<Token> content = new ArrayList<Token>();
        entityWords(np, content, false);
        return content;
      }
      return null;
    }

    /**
     * Collapse every SBAR below np to an SBR node holding only its words.
     */
    private void reduceSubordinates(Tree np) {
      Tree sbar = firstExact(np, "SBAR");
      while( sbar != null ) {
        List<Tree> words = new ArrayList<Tree>();
        for( String word : TreeOperator.stringLeavesFromTree(sbar) )
          words.add(TreeOperator.factory().newLeaf(word));
        Tree sbr = TreeOperator.factory().newTreeNode("SBR", words);
        TreeOperator.replaceChild(sbar.parent(np), sbar, sbr);
        sbar = firstExact(np, "SBAR");
      }
    }

    private Tree firstExact(Tree tree, String label) {
      for( Tree node : tree.preOrderNodeList() ) {
        if( node != tree && !node.isLeaf() && label.equals(node.value()) )
          return node;
      }
      return null;
    }

    /**
     * Flatten (NP (NP|NEC ...) ... (IN ...) ... (NP|NEC ...) [SBR]) into one
     * entity.  Any other shape, or a second level of prepositional phrase,
     * returns null and the noun phrase keeps its structure.
     */
    private List<Token> preposition(Tree pp) {
      Tree parent = pp.parent(_root);
      if( parent == null || !"NP".equals(parent.value()) || parent.numChildren() == 0 )
        return null;
      Tree first = parent.getChild(0);
      String firstLabel = (first.isLeaf() ? "" : first.value());
      List<Token> content = new ArrayList<Token>();
      if( firstLabel.startsWith("NP") )
        entityWords(first, content, false);
      else if( firstLabel.startsWith(Token.COMPOUND) )
        copyRaw(first, content);
      else
        return null;

      // everything after the first child, in preorder
      List<Tree> rest = new ArrayList<Tree>();
      for( int i = 1; i < parent.numChildren(); i++ )
        rest.addAll(parent.getChild(i).preOrderNodeList());

      int kin = -1;
      for( int i = 0; i < rest.size() && kin < 0; i++ )
        if( !rest.get(i).isLeaf() && "IN".equals(rest.get(i).value()) ) kin = i;
      if( kin < 0 ) return null;
      for( String word : TreeOperator.stringLeavesFromTree(rest.get(kin)) )
        content.add(Token.word(word));

      int kobj = -1;
      for( int i = kin + 1; i < rest.size() && kobj < 0; i++ ) {
        Tree node = rest.get(i);
        if( !node.isLeaf() && ("NP".equals(node.value()) || Token.COMPOUND.equals(node.value())) )
          kobj = i;
      }
      if( kobj < 0 ) return null;
      Tree obj = rest.get(kobj);
      if( TreeOperator.hasDescendant(obj, "PP") )
        return null;
      if( Token.COMPOUND.equals(obj.value()) )
        copyRaw(obj, content);
      else
        entityWords(obj, content, false);

      for( int i = kobj + obj.size(); i < rest.size(); i++ ) {
        Tree node = rest.get(i);
        if( !node.isLeaf() && "SBR".equals(node.value()) ) {
          for( String word : TreeOperator.stringLeavesFromTree(node) )
            content.add(Token.word(word));
          break;
        }
      }
      return content;
    }

    /**
     * The words below node with markup removed, except that compounds are
     * copied with their structure so the resolver can expand them.
     */
    private void entityWords(Tree node, List<Token> out, boolean skipPossessive) {
      for( Tree child : node.children() ) {
        if( child.isLeaf() )
          out.add(Token.word(child.value()));
        else if( Token.COMPOUND.equals(child.value()) )
          copyRaw(child, out);
        else if( skipPossessive && child.value() != null && child.value().startsWith("POS") )
          continue;
        else
          entityWords(child, out, skipPossessive);
      }
    }

    private void copyRaw(Tree node, List<Token> out) {
      if( node.isLeaf() ) {
        out.add(Token.word(node.value()));
        return;
      }
      out.add(Token.open(node.value()));
      for( Tree child : node.children() )
        copyRaw(child, out);
      out.add(Token.pendingClose());
    }

    private boolean addEntity(List<Token> content) {
      boolean hasWord = false;
      for( Token tok : content )
        if( tok.isWord() ) hasWord = true;
      if( !hasWord ) return false;

      _seq.add(Token.open(Token.ENTITY));
      _seq.add(Token.code());
      for( Token tok : content )
        _seq.add(tok);
      _seq.add(Token.pendingClose());
      return true;
    }

    /**
     * Each noun head of a compound becomes its own entity.  Adjectives seen
     * before the first head are repeated on every head; conjunctions and
     * punctuation are dropped.
     */
    private boolean compound(Tree nec) {
      List<Token> adjectives = new ArrayList<Token>();
      boolean[] headSeen = new boolean[1];
      return compoundHeads(nec, adjectives, headSeen);
    }

    private boolean compoundHeads(Tree node, List<Token> adjectives, boolean[] headSeen) {
      for( Tree child : node.children() ) {
        if( child.isLeaf() ) continue;
        String label = child.value();
        if( label.startsWith("NP") || label.startsWith("NN") ) {
          headSeen[0] = true;
          List<Token> content = new ArrayList<Token>();
          for( Token adj : adjectives )
            content.add(adj.copy());
          entityWords(child, content, false);
          if( !addEntity(content) ) return false;
        }
        else if( !headSeen[0] && label.startsWith("JJ") ) {
          for( String word : TreeOperator.stringLeavesFromTree(child) )
            adjectives.add(Token.word(word));
        }
        else if( !compoundHeads(child, adjectives, headSeen) )
          return false;
      }
      return true;
    }
  }
}
