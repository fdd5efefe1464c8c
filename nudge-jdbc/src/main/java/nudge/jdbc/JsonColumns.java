package nudge.jdbc;

import nudge.condition.ConditionSet;
import nudge.condition.Operator;
import nudge.condition.TriggerCondition;
import nudge.model.Channel;
import nudge.model.QuietHours;
import nudge.model.TimeWindow;
import nudge.util.JsonCodec;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mapping between rule fields and their JSON columns.
 *
 * <p>Conditions are stored as {@code {"logic": "and", "conditions": [{"field", "operator",
 * "value"}]}}; a bare array is read as an AND set. Time windows are stored as
 * {@code {"allowedHours": [9, 10], "allowedDays": [1], "quietHours": {"start": "22:00",
 * "end": "06:00"}}} with days Sunday-based, and the zone in its own column.
 */
final class JsonColumns {
  private final JsonCodec json;

  JsonColumns(JsonCodec json) {
    this.json = json;
  }

  String conditions(ConditionSet set) {
    if (set == null || set.isEmpty()) {
      return null;
    }
    List<Object> items = new ArrayList<>();
    for (TriggerCondition condition : set.conditions()) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("field", condition.field());
      item.put("operator", condition.operator().code());
      item.put("value", condition.value().raw());
      items.add(item);
    }
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("logic", set.logic().name().toLowerCase(Locale.ROOT));
    root.put("conditions", items);
    return json.toJson(root);
  }

  ConditionSet conditions(String text) {
    Object parsed = json.parse(text);
    if (parsed == null) {
      return ConditionSet.EMPTY;
    }
    ConditionSet.Logic logic = ConditionSet.Logic.AND;
    Object items = parsed;
    if (parsed instanceof Map<?, ?> root) {
      Object logicCode = root.get("logic");
      if (logicCode != null && "or".equalsIgnoreCase(logicCode.toString())) {
        logic = ConditionSet.Logic.OR;
      }
      items = root.get("conditions");
    }
    List<TriggerCondition> conditions = new ArrayList<>();
    if (items instanceof List<?> list) {
      for (Object item : list) {
        if (item instanceof Map<?, ?> map) {
          Object field = map.get("field");
          Object operator = map.get("operator");
          conditions.add(TriggerCondition.of(field == null ? "" : field.toString(),
              Operator.fromCode(operator == null ? null : operator.toString()), map.get("value")));
        }
      }
    }
    return new ConditionSet(conditions, logic);
  }

  String strings(Set<String> values) {
    return values == null || values.isEmpty() ? null : json.toJson(new ArrayList<>(values));
  }

  Set<String> strings(String text) {
    Set<String> values = new LinkedHashSet<>();
    for (Object value : json.parseArray(text)) {
      if (value != null) {
        values.add(value.toString());
      }
    }
    return values;
  }

  String channels(List<Channel> channels) {
    List<String> codes = new ArrayList<>();
    for (Channel channel : channels) {
      codes.add(channel.code());
    }
    return json.toJson(codes);
  }

  List<Channel> channels(String text) {
    List<Channel> channels = new ArrayList<>();
    for (Object value : json.parseArray(text)) {
      if (value != null) {
        channels.add(Channel.fromCode(value.toString()));
      }
    }
    return channels;
  }

  String timeWindow(TimeWindow window) {
    if (window == null) {
      return null;
    }
    Map<String, Object> root = new LinkedHashMap<>();
    if (!window.allowedHours().isEmpty()) {
      root.put("allowedHours", new ArrayList<>(window.allowedHours()));
    }
    if (!window.allowedDays().isEmpty()) {
      List<Integer> days = new ArrayList<>();
      for (DayOfWeek day : window.allowedDays()) {
        days.add(TimeWindow.dayIndex(day));
      }
      root.put("allowedDays", days);
    }
    if (window.quietHours() != null) {
      Map<String, Object> quiet = new LinkedHashMap<>();
      quiet.put("start", QuietHours.format(window.quietHours().startHour()));
      quiet.put("end", QuietHours.format(window.quietHours().endHour()));
      root.put("quietHours", quiet);
    }
    return json.toJson(root);
  }

  TimeWindow timeWindow(String text, String timezone) {
    Map<String, Object> root = json.parseObject(text);
    if (root.isEmpty()) {
      return null;
    }
    Set<Integer> hours = new LinkedHashSet<>();
    for (Object hour : listOf(root.get("allowedHours"))) {
      hours.add(((Number) hour).intValue());
    }
    Set<DayOfWeek> days = new LinkedHashSet<>();
    for (Object day : listOf(root.get("allowedDays"))) {
      days.add(TimeWindow.dayOf(((Number) day).intValue()));
    }
    QuietHours quiet = null;
    if (root.get("quietHours") instanceof Map<?, ?> q && q.get("start") != null && q.get("end") != null) {
      quiet = QuietHours.parse(q.get("start").toString(), q.get("end").toString());
    }
    ZoneId zone = timezone == null || timezone.isBlank() ? null : ZoneId.of(timezone.trim());
    return new TimeWindow(hours, days, quiet, zone);
  }

  String data(Map<String, Object> data) {
    return data == null || data.isEmpty() ? null : json.toJson(data);
  }

  Map<String, Object> data(String text) {
    return json.parseObject(text);
  }

  private static List<?> listOf(Object value) {
    return value instanceof List<?> list ? list : List.of();
  }
}
