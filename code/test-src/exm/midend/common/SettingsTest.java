package exm.midend.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.midend.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testDefaults() throws InvalidOptionException {
    Settings settings = Settings.defaultSettings();
    settings.validate();
    assertTrue(settings.getBoolean(Settings.EXTERNALLY_VISIBLE_ONLY));
    assertFalse(settings.getBoolean(Settings.UNDEFINED_OFFSETS));
    assertTrue(settings.getBoolean(Settings.VALIDATE_CFG));
    assertTrue(settings.getBoolean(Settings.LOWER_PRIVATE_MEMBERS));
    assertEquals("", settings.get(Settings.LOG_FILE));
  }

  @Test
  public void testInstancesAreIndependent() throws InvalidOptionException {
    Settings a = Settings.defaultSettings();
    Settings b = Settings.defaultSettings();
    a.set(Settings.UNDEFINED_OFFSETS, " TRUE ");
    assertTrue(a.getBoolean(Settings.UNDEFINED_OFFSETS));
    assertFalse(b.getBoolean(Settings.UNDEFINED_OFFSETS));
  }

  @Test
  public void testKeysSorted() {
    Settings settings = Settings.defaultSettings();
    settings.set("midend.extra", "x");
    assertEquals(7, settings.getKeys().size());
    assertEquals("midend.cfg.validate", settings.getKeys().get(0));
    assertTrue(settings.getKeys().contains("midend.extra"));
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings settings = Settings.defaultSettings();
    settings.set(Settings.VALIDATE_CFG, "yes");
    exception.expect(InvalidOptionException.class);
    settings.validate();
  }

  @Test
  public void testMissingBoolean() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    Settings.defaultSettings().getBoolean("midend.no-such-option");
  }
}
