package jproperties;

public interface PropertiesMapper {
    OrderedStore toStore(String data);

    String toText(OrderedStore store);

    void validate(String data);
}
