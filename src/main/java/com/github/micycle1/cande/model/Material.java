package com.github.micycle1.cande.model;

import java.util.List;
import java.util.Objects;

import com.github.micycle1.cande.CandeConstants;

/**
 * An immutable material record. Soil and interface materials correspond to a D-1
 * header; the records following the header are kept verbatim in
 * {@link #getPropertyRecords()} and written back unchanged.
 */
public final class Material {

	private final int id;
	private final MaterialKind kind;
	private final int typeCode;
	private final double density;
	private final String name;
	private final double friction;
	private final double orientation;
	private final List<String> propertyRecords;

	public Material(int id, MaterialKind kind, int typeCode, double density, String name, double friction, double orientation,
			List<String> propertyRecords) {
		this.id = id;
		this.kind = Objects.requireNonNull(kind, "kind");
		this.typeCode = typeCode;
		this.density = density;
		this.name = name == null ? "" : name;
		this.friction = friction;
		this.orientation = orientation;
		this.propertyRecords = List.copyOf(propertyRecords);
	}

	public static Material soil(int id, int typeCode, double density, String name, List<String> propertyRecords) {
		return new Material(id, MaterialKind.SOIL, typeCode, density, name, Double.NaN, Double.NaN, propertyRecords);
	}

	/**
	 * Creates a synthesized interface material named {@code Inter #<id>}.
	 */
	public static Material interfaceMaterial(int id, double friction, double orientation) {
		return new Material(id, MaterialKind.INTERFACE, CandeConstants.INTERFACE_MATERIAL_TYPE, 0, "Inter #" + id, friction, orientation,
				List.of());
	}

	/**
	 * Placeholder for a beam pipe group defined outside the supported records.
	 */
	public static Material structural(int id) {
		return new Material(id, MaterialKind.STRUCTURAL, 0, 0, "", Double.NaN, Double.NaN, List.of());
	}

	public int getId() {
		return id;
	}

	public MaterialKind getKind() {
		return kind;
	}

	public boolean isInterface() {
		return kind == MaterialKind.INTERFACE;
	}

	public int getTypeCode() {
		return typeCode;
	}

	public double getDensity() {
		return density;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the friction coefficient, NaN unless this is an interface material
	 */
	public double getFriction() {
		return friction;
	}

	/**
	 * @return the interface normal in degrees, NaN unless this is an interface
	 *         material
	 */
	public double getOrientation() {
		return orientation;
	}

	/**
	 * @return the raw records that followed the D-1 header in the source file
	 *         (without line terminators); empty for materials created in memory
	 */
	public List<String> getPropertyRecords() {
		return propertyRecords;
	}

	public InterfaceMaterialKey getInterfaceKey() {
		if (!isInterface()) {
			throw new IllegalStateException("Material " + id + " is not an interface material");
		}
		return InterfaceMaterialKey.of(friction, orientation);
	}

	// property records are source text, not content
	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		Material that = (Material) o;
		return id == that.id && kind == that.kind && typeCode == that.typeCode && Double.compare(density, that.density) == 0
				&& name.equals(that.name) && Double.compare(friction, that.friction) == 0 && Double.compare(orientation, that.orientation) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, kind, typeCode, density, name, friction, orientation);
	}

	@Override
	public String toString() {
		if (isInterface()) {
			return "Material{" + id + " INTERFACE friction=" + friction + " orientation=" + orientation + '}';
		}
		return "Material{" + id + " " + kind + " type=" + typeCode + " '" + name + "'}";
	}
}
