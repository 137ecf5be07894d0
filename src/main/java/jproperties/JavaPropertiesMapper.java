package jproperties;

import org.apache.commons.lang3.Validate;

public class JavaPropertiesMapper implements PropertiesMapper {

    private final RecordParser parser = new RecordParser();
    private final Serializer serializer;

    public JavaPropertiesMapper() {
        this(PropertiesFormat.DEFAULT);
    }

    public JavaPropertiesMapper(PropertiesFormat format) {
        this.serializer = new Serializer(format);
    }

    @Override
    public OrderedStore toStore(String data) {
        return parser.parse(data == null ? "" : data);
    }

    @Override
    public String toText(OrderedStore store) {
        return serializer.toText(Validate.notNull(store, "store"));
    }

    @Override
    public void validate(String data) {
        Validate.notNull(data, "data");
        parser.records(LineAssembler.of(data));
    }
}
