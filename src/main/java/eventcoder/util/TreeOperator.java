package eventcoder.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import edu.stanford.nlp.trees.LabeledScoredTreeFactory;
import edu.stanford.nlp.trees.PennTreeReader;
import edu.stanford.nlp.trees.Tree;
import edu.stanford.nlp.trees.TreeFactory;


/**
 * Static helpers over Stanford trees.
 */
public class TreeOperator {
  private static final TreeFactory _tf = new LabeledScoredTreeFactory();

  public static TreeFactory factory() { return _tf; }

  /**
   * @desc Read one bracketed parse.
   * @return The tree, or null if the string holds no tree.
   */
  public static Tree stringToTree(String parse) throws IOException {
    PennTreeReader treeReader = new PennTreeReader(new BufferedReader(new StringReader(parse)), _tf);
    try {
      return treeReader.readTree();
    } finally {
      treeReader.close();
    }
  }

  /**
   * @return The words of the tree's leaves, in order.
   */
  public static List<String> stringLeavesFromTree(Tree tree) {
    List<String> strs = new ArrayList<String>();
    List<Tree> leaves = tree.getLeaves();
    for( Tree leaf : leaves )
      strs.add(leaf.value());
    return strs;
  }

  /**
   * True if a node strictly below the given one has a label with this prefix.
   */
  public static boolean hasDescendant(Tree tree, String prefix) {
    return firstDescendant(tree, prefix) != null;
  }

  /**
   * @return The first node below the given one, in preorder, whose label has
   *         this prefix.  Leaves are not considered.
   */
  public static Tree firstDescendant(Tree tree, String prefix) {
    for( Tree child : tree.children() ) {
      if( child.isLeaf() ) continue;
      if( child.value() != null && child.value().startsWith(prefix) )
        return child;
      Tree sub = firstDescendant(child, prefix);
      if( sub != null ) return sub;
    }
    return null;
  }

  /**
   * Count the nodes in the subtree, the root included, with this label prefix.
   */
  public static int countLabels(Tree tree, String prefix) {
    int count = 0;
    for( Tree node : tree.preOrderNodeList() ) {
      if( !node.isLeaf() && node.value() != null && node.value().startsWith(prefix) )
        count++;
    }
    return count;
  }

  /**
   * Replace one child of parent, compared by identity.
   */
  public static void replaceChild(Tree parent, Tree oldChild, Tree newChild) {
    Tree[] kids = parent.children();
    for( int i = 0; i < kids.length; i++ ) {
      if( kids[i] == oldChild ) {
        parent.setChild(i, newChild);
        return;
      }
    }
  }

  /**
   * Upper-case every word of the tree.
   */
  public static void upperCaseLeaves(Tree tree) {
    List<Tree> leaves = tree.getLeaves();
    for( Tree leaf : leaves )
      leaf.setValue(leaf.value().toUpperCase());
  }
}
