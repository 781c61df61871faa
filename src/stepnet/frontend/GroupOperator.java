package stepnet.frontend;

/** How a condition group combines with its preceding sibling groups. */
public enum GroupOperator { AND, OR }
