package dk.cloudcreate.cqrs.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * The name of a category of aggregates, e.g. <b>user</b>.<br>
 * The aggregate type is carried by every command and event envelope and is used to route
 * commands to the command channel of the service owning that type of aggregate and to
 * pick the factory that creates an empty aggregate instance before replay.<br>
 * <b>Note: The aggregate type is only a name and shouldn't be confused with the Fully Qualified Class Name of an aggregate implementation class</b>
 */
public class AggregateType extends CharSequenceType<AggregateType> {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
