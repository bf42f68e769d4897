package org.fusequery.util;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.joda.JodaModule;

/**
 * Holds the shared JSON {@link ObjectMapper} used to encode plans, group keys and partial aggregate states.
 */
public final class FuseJsonMapperProvider {
  /** Only create this object once, and share it. */
  private static final ObjectMapper MAPPER = newMapper();

  /** Utility classes should not be instantiated. */
  private FuseJsonMapperProvider() {}

  /**
   * @return An {@link ObjectMapper} that fits FuseQuery's customizations.
   */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }

  /**
   * @return An {@link ObjectWriter} that fits FuseQuery's customizations.
   */
  public static ObjectWriter getWriter() {
    return MAPPER.writer();
  }

  /**
   * Create the standard FuseQuery custom ObjectMapper.
   *
   * @return the standard FuseQuery custom ObjectMapper.
   */
  private static ObjectMapper newMapper() {
    ObjectMapper mapper = new ObjectMapper();

    /* Serialize DateTimes as Strings */
    mapper.registerModule(new JodaModule());
    /* Serialize Guava types correctly */
    mapper.registerModule(new GuavaModule());

    mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    /* Don't automatically detect getters, explicit is better than implicit. */
    mapper.setVisibility(PropertyAccessor.GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.IS_GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.SETTER, Visibility.NONE);

    return mapper;
  }
}
